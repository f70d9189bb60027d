package com.example.notifyrelay.delivery;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DoublingBackOffPolicyTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void testDelayDoublesFrom100ms() {
        assertEquals(Duration.ofMillis(100), DoublingBackOffPolicy.delay(0));
        assertEquals(Duration.ofMillis(200), DoublingBackOffPolicy.delay(1));
        assertEquals(Duration.ofMillis(400), DoublingBackOffPolicy.delay(2));
        assertEquals(Duration.ofMillis(800), DoublingBackOffPolicy.delay(3));
    }

    @Test
    void testBackOffSleepsForNextAttempt() {
        List<Long> sleeps = new ArrayList<>();
        DoublingBackOffPolicy policy = new DoublingBackOffPolicy(sleeps::add);

        BackOffContext context = policy.start(null);
        policy.backOff(context);
        policy.backOff(context);

        assertEquals(List.of(200L, 400L), sleeps);
    }

    @Test
    void testContextsAreIndependent() {
        List<Long> sleeps = new ArrayList<>();
        DoublingBackOffPolicy policy = new DoublingBackOffPolicy(sleeps::add);

        policy.backOff(policy.start(null));
        policy.backOff(policy.start(null));

        assertEquals(List.of(200L, 200L), sleeps);
    }

    @Test
    void testInterruptedSleepKeepsInterruptFlag() {
        DoublingBackOffPolicy policy = new DoublingBackOffPolicy(period -> {
            throw new InterruptedException("shutdown");
        });

        BackOffContext context = policy.start(null);

        assertThrows(BackOffInterruptedException.class, () -> policy.backOff(context));
        assertTrue(Thread.currentThread().isInterrupted());
    }
}
