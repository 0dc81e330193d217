package io.prism.rag.qa.agent.provider;

import org.springframework.ai.retry.TransientAiException;

/**
 * Rate limit, timeout or server-side failure of a model provider. Retried by
 * {@link RetryPolicy}, surfaced once attempts run out.
 */
public class ProviderTransientException extends TransientAiException {

    private final String provider;
    private final int statusCode;

    public ProviderTransientException(String provider, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String getProvider() {
        return provider;
    }

    /** HTTP status, or {@code -1} for I/O failures. */
    public int getStatusCode() {
        return statusCode;
    }
}
