package com.riskrails;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RiskRailsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskRailsApplication.class, args);
    }
}
