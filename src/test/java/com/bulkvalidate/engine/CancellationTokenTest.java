package com.bulkvalidate.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CancellationTokenTest {

    @Test
    void explicitCancel() {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());
        token.cancel();
        assertTrue(token.isCancelled());
    }

    @Test
    void deadlineCancels() throws Exception {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(20));
        assertFalse(token.isCancelled());
        Thread.sleep(60);
        assertTrue(token.isCancelled());
    }

    @Test
    void zeroTimeoutIsAlreadyCancelled() {
        assertTrue(CancellationToken.withTimeout(Duration.ZERO).isCancelled());
    }

    @Test
    void hugeTimeoutsNeverFireAndDoNotOverflow() {
        assertFalse(CancellationToken.withTimeout(Duration.ofDays(365L * 300)).isCancelled());
        assertFalse(CancellationToken.withTimeout(Duration.ofSeconds(Long.MAX_VALUE)).isCancelled());
        assertFalse(CancellationToken.withTimeout(Duration.ofNanos(Long.MAX_VALUE)).isCancelled());
    }

    @Test
    void longButRepresentableTimeoutDoesNotFire() {
        assertFalse(CancellationToken.withTimeout(Duration.ofDays(365L * 100)).isCancelled());
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CancellationToken.withTimeout(Duration.ofMillis(-1)));
    }
}
