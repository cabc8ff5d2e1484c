package com.showdownlab.optimizer.controller;

import com.showdownlab.optimizer.controller.dto.ApiError;
import com.showdownlab.optimizer.service.JobNotFoundException;
import com.showdownlab.optimizer.service.ModelNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to JSON error bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        log.warn("Request validation failed: {}", details);

        return ResponseEntity.badRequest().body(ApiError.builder()
                .code("VALIDATION_FAILED")
                .message("Request validation failed")
                .details(details)
                .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiError.builder()
                .code("MALFORMED_REQUEST")
                .message("Request body could not be parsed")
                .build());
    }

    // Also covers InvalidLineupInputException
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleInvalidInput(IllegalArgumentException e) {
        log.warn("Invalid input: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiError.builder()
                .code("INVALID_INPUT")
                .message(e.getMessage())
                .build());
    }

    @ExceptionHandler({ JobNotFoundException.class, ModelNotFoundException.class })
    public ResponseEntity<ApiError> handleNotFound(RuntimeException e) {
        log.warn("Not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.builder()
                .code("NOT_FOUND")
                .message(e.getMessage())
                .build());
    }
}
