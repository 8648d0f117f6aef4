package me.golemcore.gateway.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadlineTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldReportRemainingTime() {
        Deadline deadline = Deadline.after(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(30));

        assertEquals(NOW.plusSeconds(30), deadline.getExpiresAt());
        assertEquals(Duration.ofSeconds(30), deadline.remaining());
        assertFalse(deadline.isExpired());
    }

    @Test
    void shouldNeverReportNegativeRemaining() {
        Deadline deadline = Deadline.after(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(-5));

        assertEquals(Duration.ZERO, deadline.remaining());
        assertTrue(deadline.isExpired());
    }

    @Test
    void shouldBeExpiredWithZeroBudget() {
        Deadline deadline = Deadline.after(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ZERO);

        assertTrue(deadline.isExpired());
    }

    @Test
    void shouldCapSubBudgetByRemainingTime() {
        Deadline deadline = Deadline.after(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(5));

        assertEquals(Duration.ofSeconds(2), deadline.cap(Duration.ofSeconds(2)));
        assertEquals(Duration.ofSeconds(5), deadline.cap(Duration.ofSeconds(15)));
        assertEquals(Duration.ofSeconds(5), deadline.cap(null));
        assertEquals(Duration.ofSeconds(5), deadline.cap(Duration.ZERO));
    }
}
