package de.htwsaar.mediavault.core.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Wiederholungsbudget mit exponentiellem Backoff.
 *
 * @param attempts    Anzahl Versuche insgesamt (mindestens 1)
 * @param backoffBase Wartezeit vor dem zweiten Versuch; verdoppelt sich danach
 */
public record RetryPolicy(int attempts, Duration backoffBase) {

    public static final int DEFAULT_ATTEMPTS = 3;
    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);

    public RetryPolicy {
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1: " + attempts);
        }
        if (backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must not be negative: " + backoffBase);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_ATTEMPTS, DEFAULT_BACKOFF);
    }

    /**
     * Wartezeit vor Versuch {@code attempt} (1-basiert): 0, base, 2·base, 4·base, ...
     *
     * @param attempt Nummer des anstehenden Versuchs
     * @return Wartezeit
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) return Duration.ZERO;
        return backoffBase.multipliedBy(1L << Math.min(attempt - 2, 30));
    }
}
