package com.purchasingpower.copilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WealthAdvisorCopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(WealthAdvisorCopilotApplication.class, args);
    }
}
