package com.missioncontrol.dispatch.api;

import com.missioncontrol.core.model.InvalidPlanStateException;
import com.missioncontrol.core.model.TaskNotFoundException;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the core's typed failures to status codes with an {@code {"error": message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof ValidationException validation) {
                return error(HttpStatus.BAD_REQUEST, validation.getMessage());
            }
            cause = cause.getCause();
        }
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(TaskNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidPlanStateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidState(InvalidPlanStateException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, String>> handleStore(StoreException e) {
        log.error("Store failure while handling request", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Record store unavailable");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
