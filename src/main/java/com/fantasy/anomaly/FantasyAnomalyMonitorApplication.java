package com.fantasy.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FantasyAnomalyMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FantasyAnomalyMonitorApplication.class, args);
    }
}
