package com.resumeparse.api.exception;

import com.resumeparse.api.dto.response.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.append(fieldName).append(": ").append(error.getDefaultMessage()).append("; ");
        });
        
        return ResponseEntity.badRequest().body(build(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString(), request));
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("[API] Unreadable request body | error={}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(build(HttpStatus.BAD_REQUEST, "Malformed request body",
            "Expected JSON of the form {\"documents\":[{\"filename\":\"...\",\"text\":\"...\"}]}", request));
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("[API] Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request));
    }
    
    private ErrorResponse build(HttpStatus status, String message, String error, WebRequest request) {
        return ErrorResponse.builder()
            .message(message)
            .error(error)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
    }
}
