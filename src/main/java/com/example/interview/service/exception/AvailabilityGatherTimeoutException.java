package com.example.interview.service.exception;

import com.example.interview.dto.SchedulingErrorType;

public class AvailabilityGatherTimeoutException extends SchedulingException {

    public AvailabilityGatherTimeoutException(String message) {
        super(SchedulingErrorType.AVAILABILITY_GATHER_TIMEOUT, message);
    }

    public AvailabilityGatherTimeoutException(String message, Throwable cause) {
        super(SchedulingErrorType.AVAILABILITY_GATHER_TIMEOUT, message, cause);
    }
}
