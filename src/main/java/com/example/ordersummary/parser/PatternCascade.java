package com.example.ordersummary.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of matchers for one field. The first step returning a non-null,
 * non-blank value wins; when no step matches the field resolves to null.
 *
 * @param <T> resolved value type
 */
public final class PatternCascade<T> {

    private static final Logger log = LoggerFactory.getLogger(PatternCascade.class);

    private final String field;
    private final List<Step<T>> steps;

    private PatternCascade(String field, List<Step<T>> steps) {
        this.field = field;
        this.steps = List.copyOf(steps);
    }

    public static <T> Builder<T> of(String field) {
        return new Builder<>(field);
    }

    public T resolve(String text) {
        for (Step<T> step : steps) {
            T value = step.matcher.apply(text);
            if (isPresent(value)) {
                log.debug("Extracted {} ({}): '{}'", field, step.name, value);
                return value;
            }
        }
        log.info("Could not extract {} from text", field);
        return null;
    }

    public List<String> stepNames() {
        List<String> names = new ArrayList<>();
        for (Step<T> s : steps) names.add(s.name);
        return names;
    }

    private static boolean isPresent(Object value) {
        if (value == null) return false;
        if (value instanceof String) return !((String) value).isBlank();
        if (value instanceof List) return !((List<?>) value).isEmpty();
        return true;
    }

    private static final class Step<T> {
        final String name;
        final Function<String, T> matcher;

        Step(String name, Function<String, T> matcher) {
            this.name = name;
            this.matcher = matcher;
        }
    }

    public static final class Builder<T> {
        private final String field;
        private final List<Step<T>> steps = new ArrayList<>();

        private Builder(String field) {
            this.field = field;
        }

        public Builder<T> step(String name, Function<String, T> matcher) {
            steps.add(new Step<>(name, matcher));
            return this;
        }

        public PatternCascade<T> build() {
            return new PatternCascade<>(field, steps);
        }
    }
}
