package com.baz.contactsapi.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs where the service listens on startup and when shutdown begins. The pooled
 * {@code DataSource} is a context singleton, so Spring closes it once after in-flight
 * requests have drained.
 */
@Component
public class LifecycleLogger {

    private static final Logger log = LoggerFactory.getLogger(LifecycleLogger.class);

    private final Environment environment;

    public LifecycleLogger(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        String port = environment.getProperty("local.server.port",
                environment.getProperty("server.port", "8000"));
        log.info("Server running on http://localhost:{}", port);
        log.info("Connected to database {}", environment.getProperty("spring.datasource.url"));
    }

    @EventListener(ContextClosedEvent.class)
    public void onClose() {
        log.info("Shutting down gracefully...");
    }
}
