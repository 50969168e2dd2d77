package com.precare.risk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrecareRiskServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrecareRiskServiceApplication.class, args);
    }
}
