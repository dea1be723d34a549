package com.isengard.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Job orchestration for LoRA training and image generation: REST submission,
 * a DB-backed queue, an in-process worker pool driving the engines, and
 * resumable live progress streams.
 *
 * To run:
 *   SPRING_DATASOURCE_URL=jdbc:postgresql://localhost:5432/isengard mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
public class IsengardOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IsengardOrchestratorApplication.class, args);
    }
}
