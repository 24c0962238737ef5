package com.erpdashboard.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/erp")
                .withProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET)
                .withProperty("jwt.expiration", "604800000")
                .withProperty("app.cors.allowed-origins", "http://localhost:5173")
                .withProperty("erp.identifiers.zone", "Asia/Dhaka");
    }

    @Test
    void completeConfigurationPasses() {
        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.collectProblems()).isEmpty();
        validator.validateEnvironment();
    }

    @Test
    void missingKeysAreReported() {
        environment.setProperty("jwt.secret", " ");
        environment.setProperty("app.cors.allowed-origins", "");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder("missing jwt.secret", "missing app.cors.allowed-origins");
    }

    @Test
    void expirationOutsideBoundsIsReported() {
        environment.setProperty("jwt.expiration", "1000");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .hasSize(1)
                .allSatisfy(problem -> assertThat(problem).contains("jwt.expiration"));
    }

    @Test
    void unknownZoneAbortsStartup() {
        environment.setProperty("erp.identifiers.zone", "Mars/Olympus");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("erp.identifiers.zone");
    }
}
