package com.scheduler.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides when a failed or timed out run is retried.
 * Immutable and shared by every task a worker handles.
 *
 * Invariants:
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    Mode mode,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor
) {
    /**
     * When a retry becomes due.
     */
    public enum Mode {
        /**
         * Due again as soon as the failure is recorded.
         */
        IMMEDIATE,

        /**
         * Due after an exponentially growing delay.
         */
        BACKOFF,

        /**
         * Due at the next regular fire time; one-shot tasks retry immediately.
         */
        NEXT_SCHEDULE
    }

    public RetryPolicy {
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
    }

    /**
     * Default retry policy: retry right away.
     */
    public static RetryPolicy immediate() {
        return new RetryPolicy(Mode.IMMEDIATE, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Exponential backoff starting at 1s, capped at 5 minutes.
     */
    public static RetryPolicy defaultBackoff() {
        return new RetryPolicy(Mode.BACKOFF, Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0, 0.1);
    }

    /**
     * Retry at the next regular fire time.
     */
    public static RetryPolicy nextSchedule() {
        return new RetryPolicy(Mode.NEXT_SCHEDULE, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Compute the backoff duration for a given failure number.
     *
     * @param failureNumber 1-indexed count of consecutive failures
     * @return Duration to wait before the retry
     */
    public Duration computeBackoff(int failureNumber) {
        if (failureNumber < 1) {
            throw new IllegalArgumentException("Failure number must be >= 1");
        }
        if (mode != Mode.BACKOFF) {
            return Duration.ZERO;
        }

        // Base backoff: initialBackoff * (multiplier ^ (failure - 1))
        double baseBackoffMs = initialBackoff.toMillis() *
            Math.pow(backoffMultiplier, failureNumber - 1);

        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        // Apply jitter: backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange +
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Compute when the retry becomes due.
     *
     * @param failedAt When the failed run finished
     * @param failureNumber 1-indexed count of failures including this one
     * @param nextScheduled The next regular fire time, or null for one-shot tasks
     * @return The retry's next run time
     */
    public Instant retryAt(Instant failedAt, int failureNumber, Instant nextScheduled) {
        return switch (mode) {
            case IMMEDIATE -> failedAt;
            case BACKOFF -> failedAt.plus(computeBackoff(failureNumber));
            case NEXT_SCHEDULE -> nextScheduled != null ? nextScheduled : failedAt;
        };
    }

    /**
     * Builder for RetryPolicy.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Mode mode = Mode.IMMEDIATE;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;

        public Builder mode(Mode mode) {
            this.mode = mode;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(mode, initialBackoff, maxBackoff, backoffMultiplier, jitterFactor);
        }
    }
}
