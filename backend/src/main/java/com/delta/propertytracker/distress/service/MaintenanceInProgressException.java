package com.delta.propertytracker.distress.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class MaintenanceInProgressException extends RuntimeException {
    public MaintenanceInProgressException(String message) {
        super(message);
    }
}
