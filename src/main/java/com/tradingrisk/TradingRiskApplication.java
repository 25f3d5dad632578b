package com.tradingrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradingRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradingRiskApplication.class, args);
    }
}
