package com.erpdashboard.backend.global.time;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single time source for audit columns, token lifetimes and identifier date stamps.
 * Instants are kept in UTC; calendar dates of identifiers are taken in the business zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public ZoneId businessZone(@Value("${erp.identifiers.zone:Asia/Dhaka}") String zone) {
        return ZoneId.of(zone.trim());
    }
}
