package io.prism.rag.qa.agent.provider;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Sorts HTTP client failures into transient and non-transient provider errors.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static RuntimeException translate(String provider, RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            String message = provider + " returned HTTP " + status + ": " + abbreviate(response.getResponseBodyAsString());
            if (status == 408 || status == 429 || status >= 500) {
                return new ProviderTransientException(provider, status, message, e);
            }
            return new NonTransientAiException(message, e);
        }
        if (e instanceof ResourceAccessException) {
            return new ProviderTransientException(provider, -1, provider + " unreachable: " + e.getMessage(), e);
        }
        return new NonTransientAiException(provider + " call failed: " + e.getMessage(), e);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
