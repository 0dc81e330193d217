package io.prism.rag.indexer.controller;

import io.prism.rag.indexer.service.IndexInconsistencyException;
import io.prism.rag.indexer.service.IndexWriteException;
import io.prism.rag.indexer.service.JobNotFoundException;
import io.prism.rag.model.ApiError;
import io.prism.rag.service.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiError> handleInvalid(InvalidRequestException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IndexInconsistencyException.class)
    public ResponseEntity<ApiError> handleInconsistency(IndexInconsistencyException e) {
        log.error("Index inconsistency for document {}: {}", e.getDocumentId(), e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(IndexWriteException.class)
    public ResponseEntity<ApiError> handleWrite(IndexWriteException e) {
        log.warn("Index write rejected: {}", e.getMessage());
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
