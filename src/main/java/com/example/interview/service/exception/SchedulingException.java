package com.example.interview.service.exception;

import com.example.interview.dto.SchedulingErrorType;

public class SchedulingException extends RuntimeException {

    private final SchedulingErrorType errorType;

    public SchedulingException(SchedulingErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public SchedulingException(SchedulingErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public SchedulingErrorType getErrorType() {
        return errorType;
    }
}
