package com.assessmentplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssessmentOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(AssessmentOrchestratorApplication.class, args);
    }
}
