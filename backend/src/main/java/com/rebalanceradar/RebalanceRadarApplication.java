package com.rebalanceradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RebalanceRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(RebalanceRadarApplication.class, args);
    }
}
