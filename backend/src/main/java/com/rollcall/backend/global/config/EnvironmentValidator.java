package com.rollcall.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup when a required setting is missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-rollcall-dev-secret-change-me-rollcall";
    private static final long MIN_ACCESS_TTL_MILLIS = 60_000L;
    private static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.trim().isEmpty()) {
                problems.add(property + " is missing");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        boolean productionProfile = environment.acceptsProfiles(Profiles.of("prod"));
        if (productionProfile && jwtSecret.filter(PLACEHOLDER_SECRET::equals).isPresent()) {
            problems.add("jwt.secret still holds the development placeholder");
        }
        if (jwtSecret.filter(secret -> secret.length() < 32).isPresent()) {
            problems.add("jwt.secret must be at least 32 characters for HS256");
        }

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long ttl = Long.parseLong(expiration.trim());
                if (ttl < MIN_ACCESS_TTL_MILLIS || ttl > MAX_ACCESS_TTL_MILLIS) {
                    problems.add("jwt.expiration must be between " + MIN_ACCESS_TTL_MILLIS + " and " + MAX_ACCESS_TTL_MILLIS + " ms");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be a number of milliseconds");
            }
        }
        return problems;
    }
}
