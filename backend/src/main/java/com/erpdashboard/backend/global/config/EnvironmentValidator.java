package com.erpdashboard.backend.global.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 준비 시점에 필수 설정을 검증한다.
 * 누락되었거나 형식이 잘못된 키는 기동을 중단시키고, 개발용 JWT 시크릿은 경고만 남긴다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-jwt-secret-key-change-in-production-2025";
    private static final long MIN_JWT_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_JWT_EXPIRATION_MILLIS = 2_592_000_000L;

    private static final String[] REQUIRED_VARS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "erp.identifiers.zone"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }

        if (DEV_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            log.warn("jwt.secret is still the development default; set JWT_SECRET before deploying");
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_VARS) {
            String value = Optional.ofNullable(environment.getProperty(key)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                problems.add("missing " + key);
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < MIN_JWT_EXPIRATION_MILLIS || expiration > MAX_JWT_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration must be between 300000 and 2592000000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be a number");
            }
        });

        Optional.ofNullable(environment.getProperty("erp.identifiers.zone"))
                .filter(zone -> !zone.isBlank())
                .ifPresent(zone -> {
                    try {
                        ZoneId.of(zone.trim());
                    } catch (DateTimeException e) {
                        problems.add("erp.identifiers.zone is not a valid zone id: " + zone);
                    }
                });

        return problems;
    }
}
