package com.quotaguard.backend.exception;

/**
 * Domain failure carrying the {@code code} returned to API callers in {@code ApiError}.
 */
public class BizException extends RuntimeException {
    private final String code;

    public BizException(String code, String message) {
        super(message);
        this.code = code;
    }

    public BizException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
