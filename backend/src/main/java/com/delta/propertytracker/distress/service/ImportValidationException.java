package com.delta.propertytracker.distress.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ImportValidationException extends RuntimeException {
    private final List<String> problems;

    public ImportValidationException(String message) {
        this(message, List.of());
    }

    public ImportValidationException(String message, List<String> problems) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
