package com.example.ordersummary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrderSummaryApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderSummaryApplication.class, args);
    }
}
