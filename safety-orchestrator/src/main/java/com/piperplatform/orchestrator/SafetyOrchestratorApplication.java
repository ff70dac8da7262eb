package com.piperplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SafetyOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SafetyOrchestratorApplication.class, args);
    }
}
