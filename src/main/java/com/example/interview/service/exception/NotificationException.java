package com.example.interview.service.exception;

import com.example.interview.dto.SchedulingErrorType;

public class NotificationException extends SchedulingException {

    public NotificationException(String message, Throwable cause) {
        super(SchedulingErrorType.SCHEDULING_ERROR, message, cause);
    }
}
