package com.delta.propertytracker.distress.api;

import com.delta.propertytracker.distress.service.ImportValidationException;
import com.delta.propertytracker.distress.service.MaintenanceInProgressException;
import com.delta.propertytracker.distress.service.RunNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class TrackerExceptionHandler {

    @ExceptionHandler(MaintenanceInProgressException.class)
    public ResponseEntity<Map<String, String>> handleMaintenance(MaintenanceInProgressException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "maintenance_in_progress", "message", ex.getMessage()));
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleRunNotFound(RunNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "run_not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(ImportValidationException.class)
    public ResponseEntity<Map<String, String>> handleImportValidation(ImportValidationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_import", "message", ex.getMessage()));
    }
}
