package com.docsum.api.exception;

import com.docsum.api.dto.response.ErrorResponse;
import com.docsum.llm.exception.GenerationException;
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
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.append(fieldName).append(": ").append(errorMessage).append("; ");
        });
        
        return build(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString(), request);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body",
            "Expected a JSON object like {\"text\": \"...\"}", request);
    }
    
    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ErrorResponse> handleGenerationException(
            GenerationException ex,
            WebRequest request
    ) {
        log.error("Summarization failed | provider={} | statusCode={} | error={}",
            ex.getProvider() != null ? ex.getProvider().getDisplayName() : "n/a", ex.getStatusCode(), ex.getMessage());
        
        HttpStatus status = ex.isRateLimited() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        return build(status, "Summary generation failed", ex.getMessage(), request);
    }
    
    @ExceptionHandler(SummaryTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(
            SummaryTimeoutException ex,
            WebRequest request
    ) {
        log.warn("Summarization timed out: {}", ex.getMessage());
        return build(HttpStatus.GATEWAY_TIMEOUT, "Summary generation timed out", ex.getMessage(), request);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request);
    }
    
    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String error, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message(message)
            .error(error)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
        
        return ResponseEntity.status(status).body(errorResponse);
    }
}
