package com.quotaguard.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidRetentionStateException extends BizException {

    public InvalidRetentionStateException(String code, String message) {
        super(code, message);
    }
}
