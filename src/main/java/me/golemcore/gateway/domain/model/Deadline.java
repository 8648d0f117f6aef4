package me.golemcore.gateway.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Absolute end-to-end deadline of one mediation. Established once when the
 * request is received and threaded through every blocking call.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Clock clock, Duration budget) {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(budget, "budget");
        return new Deadline(clock, clock.instant().plus(budget));
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * Time left before expiry, never negative.
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * Shorter of a component sub-budget and the remaining end-to-end budget.
     */
    public Duration cap(Duration subBudget) {
        Duration left = remaining();
        if (subBudget == null || subBudget.isNegative() || subBudget.isZero()) {
            return left;
        }
        return subBudget.compareTo(left) < 0 ? subBudget : left;
    }

    @Override
    public String toString() {
        return "Deadline{expiresAt=" + expiresAt + ", remaining=" + remaining().toMillis() + "ms}";
    }
}
