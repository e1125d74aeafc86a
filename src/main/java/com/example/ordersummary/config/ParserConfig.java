package com.example.ordersummary.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.ordersummary.parser.OrderSummaryPageParser;

@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ParserConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * The page parser is stateless, so one instance serves every upload.
     */
    @Bean
    public OrderSummaryPageParser orderSummaryPageParser(ExtractionProperties properties, Clock clock) {
        return new OrderSummaryPageParser(properties, clock);
    }
}
