package com.casebridge.sync.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.casebridge.sync")
@ConfigurationPropertiesScan(basePackages = "com.casebridge.sync")
@EnableScheduling
public class CaseBridgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(CaseBridgeApplication.class, args);
    }
}
