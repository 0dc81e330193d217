package io.prism.rag.service;

/**
 * Rejected input: a blank query, a missing user id, an out-of-range parameter.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
