package com.adlanda.contextengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Context Engine - Main Application
 *
 * Stores, retrieves and evolves small units of contextual knowledge used to
 * enrich prompts for AI assistants across many workspaces.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embedding generation via OpenAI
 * - Spring Data JPA for the primary context store
 * - An in-memory or PGVector index for similarity search
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
@EnableScheduling
public class ContextEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextEngineApplication.class, args);
    }
}
