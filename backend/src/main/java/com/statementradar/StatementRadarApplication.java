package com.statementradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StatementRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatementRadarApplication.class, args);
    }
}
