package com.example.interview.service.exception;

import com.example.interview.dto.SchedulingErrorType;

public class ExternalLookupException extends SchedulingException {

    public ExternalLookupException(String message, Throwable cause) {
        super(SchedulingErrorType.SCHEDULING_ERROR, message, cause);
    }
}
