package com.erpdashboard.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * Problem-style error body: {@code {type, title, status, detail, instance, code}}.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String TYPE_PREFIX = "urn:problem:erp:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(typeFor(safeCode), httpStatus.getReasonPhrase(), httpStatus.value(),
                safeDetail, instance, safeCode);
    }

    static String typeFor(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.]+", "-");
    }
}
