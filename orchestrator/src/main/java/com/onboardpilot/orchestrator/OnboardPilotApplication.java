package com.onboardpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OnboardPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(OnboardPilotApplication.class, args);
    }
}
