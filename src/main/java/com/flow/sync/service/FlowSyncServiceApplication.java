package com.flow.sync.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Flow Sync Service Application - Entry point for the Spring Boot application.
 *
 * This application owns the authoritative, per-workflow graph state that
 * collaborative editors and out-of-band HTTP callers mutate concurrently. It:
 * - Serializes every mutation of a workflow through a single actor
 * - Pushes committed changes to live collaborators over STOMP
 * - Retains a pending-update log for clients that can only poll
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan("com.flow.sync.service.config")
public class FlowSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowSyncServiceApplication.class, args);
    }
}
