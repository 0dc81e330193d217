package io.prism.rag.qa.agent.provider;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.retry.TransientAiException;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded exponential-backoff retry, passed explicitly to the call sites that use it.
 *
 * <p>After the n-th failed attempt the policy waits {@code multiplier * 2^(n-1)} seconds,
 * clamped to {@code [minBackoff, maxBackoff]}. Only failures matching {@code retryable} are
 * retried; anything else propagates at once. A failure on an interrupted thread is never
 * retried and surfaces as a {@link CancellationException}.</p>
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
public class RetryPolicy {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    @Builder.Default
    private final int maxAttempts = 1;

    @Builder.Default
    private final double multiplier = 1.0d;

    @Builder.Default
    private final Duration minBackoff = Duration.ZERO;

    @Builder.Default
    private final Duration maxBackoff = Duration.ZERO;

    @Builder.Default
    private final Predicate<Throwable> retryable = TransientAiException.class::isInstance;

    @Builder.Default
    private final Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

    public static RetryPolicy none() {
        return RetryPolicy.builder().build();
    }

    /**
     * @param failedAttempts number of attempts that have failed so far, starting at 1
     */
    public Duration backoff(int failedAttempts) {
        double seconds = multiplier * Math.pow(2, failedAttempts - 1);
        Duration wait = Duration.ofMillis(Math.round(seconds * 1000));
        if (wait.compareTo(minBackoff) < 0) {
            wait = minBackoff;
        }
        if (wait.compareTo(maxBackoff) > 0) {
            wait = maxBackoff;
        }
        return wait;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw cancelled(operation + " cancelled", e);
                }
                if (!retryable.test(e) || attempt >= maxAttempts) {
                    throw e;
                }
                Duration wait = backoff(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, wait.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw cancelled(operation + " cancelled during backoff", e);
                }
            }
        }
    }

    private static CancellationException cancelled(String message, Throwable cause) {
        CancellationException cancelled = new CancellationException(message);
        cancelled.initCause(cause);
        return cancelled;
    }
}
