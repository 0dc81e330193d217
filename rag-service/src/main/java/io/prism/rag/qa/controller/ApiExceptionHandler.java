package io.prism.rag.qa.controller;

import io.prism.rag.model.ApiError;
import io.prism.rag.retrieval.RetrievalException;
import io.prism.rag.service.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps read-path failures to error bodies so they are never mistaken for an empty result.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiError> handleInvalid(InvalidRequestException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(RetrievalException.class)
    public ResponseEntity<ApiError> handleRetrieval(RetrievalException e) {
        log.warn("Retrieval failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(TransientAiException.class)
    public ResponseEntity<ApiError> handleTransient(TransientAiException e) {
        log.warn("Model provider unavailable after retries: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(NonTransientAiException.class)
    public ResponseEntity<ApiError> handleNonTransient(NonTransientAiException e) {
        log.warn("Model provider rejected the request: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiError.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .build());
    }
}
