package com.erpdashboard.backend.modules.sequence.application;

import java.time.Duration;

import com.erpdashboard.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * 카운터 저장소에 연결할 수 없거나 시간 초과 또는 일시적 오류가 발생했다. 증가는 반영되지 않았다.
 */
public class StorageUnavailableException extends RetryableProblemException {

    public static final String CODE = "STORAGE_UNAVAILABLE";
    private static final Duration RETRY_AFTER = Duration.ofSeconds(1);

    private final String counterKey;

    public StorageUnavailableException(String counterKey, Throwable cause) {
        this(counterKey, "Sequence store is unavailable", cause);
    }

    public StorageUnavailableException(String counterKey, String detail) {
        this(counterKey, detail, null);
    }

    private StorageUnavailableException(String counterKey, String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, detail, RETRY_AFTER, cause);
        this.counterKey = counterKey;
    }

    public String getCounterKey() {
        return counterKey;
    }
}
