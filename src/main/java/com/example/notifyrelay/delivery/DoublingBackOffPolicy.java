package com.example.notifyrelay.delivery;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;

/**
 * Sleeps {@code 2^attemptIndex * 100ms} before the attempt with that (0-based) index, so
 * the second attempt waits 200ms and the third 400ms.
 */
public class DoublingBackOffPolicy implements BackOffPolicy {

    private static final long BASE_DELAY_MS = 100;

    private final Sleeper sleeper;

    public DoublingBackOffPolicy(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public static Duration delay(int attemptIndex) {
        return Duration.ofMillis((1L << attemptIndex) * BASE_DELAY_MS);
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptIndexContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        AttemptIndexContext context = (AttemptIndexContext) backOffContext;
        context.nextAttemptIndex++;
        try {
            sleeper.sleep(delay(context.nextAttemptIndex).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while backing off", e);
        }
    }

    private static class AttemptIndexContext implements BackOffContext {
        private int nextAttemptIndex;
    }
}
