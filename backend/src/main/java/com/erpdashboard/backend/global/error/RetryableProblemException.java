package com.erpdashboard.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * 클라이언트가 그대로 재시도해도 되는 실패. 힌트는 {@code Retry-After} 헤더에 초 단위로 실린다.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter, Throwable cause) {
        super(status, code, detail, cause);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be zero or positive");
        }
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public long getRetryAfterSeconds() {
        long seconds = retryAfter.toSeconds();
        return retryAfter.toNanosPart() > 0 ? seconds + 1 : seconds;
    }
}
