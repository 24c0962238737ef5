package com.erpdashboard.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 기계 판독용 코드를 담은 비즈니스 예외. {@link RestExceptionHandler}가 응답으로 변환한다.
 */
public class ProblemException extends ResponseStatusException {

    private final HttpStatus httpStatus;
    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.httpStatus = status;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return ProblemResponse.typeFor(code);
    }

    public ProblemResponse toResponse(String instance) {
        return ProblemResponse.of(httpStatus, code, detail, instance);
    }
}
