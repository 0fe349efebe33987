package com.markettracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketTrackerApplication.class, args);
    }
}
