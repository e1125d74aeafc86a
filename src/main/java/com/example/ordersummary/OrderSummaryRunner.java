package com.example.ordersummary;

import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.example.ordersummary.model.ExtractedOrder;
import com.example.ordersummary.service.OrderSummaryParseService;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * Command line entry: {@code --file=report.pdf} parses the report and prints the orders as JSON.
 */
@Component
public class OrderSummaryRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(OrderSummaryRunner.class);

    private final OrderSummaryParseService parseService;

    public OrderSummaryRunner(OrderSummaryParseService parseService) {
        this.parseService = parseService;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> files = args.getOptionValues("file");
        if (files == null || files.isEmpty()) {
            log.debug("No --file argument, nothing to parse");
            return;
        }

        for (String file : files) {
            Path path = Paths.get(file);
            if (!Files.isRegularFile(path)) {
                log.error("File not found: {}", path.toAbsolutePath());
                continue;
            }
            List<ExtractedOrder> orders = parseService.parse(path);
            System.out.println(toJson(orders));
        }
    }

    static String toJson(List<ExtractedOrder> orders) {
        return gson().toJson(orders);
    }

    static Gson gson() {
        return new GsonBuilder()
                .setPrettyPrinting()
                .serializeNulls()
                .registerTypeAdapter(LocalDateTime.class, new LocalDateTimeSerializer())
                .create();
    }

    static class LocalDateTimeSerializer implements JsonSerializer<LocalDateTime> {
        @Override
        public JsonElement serialize(LocalDateTime src, Type typeOfSrc, JsonSerializationContext context) {
            return new JsonPrimitive(src.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        }
    }
}
