package de.htwsaar.mediavault.core.ratelimit;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token-Bucket: Tokens laufen kontinuierlich mit {@code rate} pro Sekunde nach, bis {@code capacity}.
 *
 * <p>Thread-Safety: einfaches {@code synchronized} um Nachfüllen und Verbrauch. Wartende Threads
 * pollen alle 10 ms; es gibt keine Fairness-Garantie zwischen Aufrufern, begrenzt wird nur der
 * Gesamtdurchsatz.</p>
 */
public final class TokenBucket implements RateLimiter {

    static final long POLL_INTERVAL_MS = 10;

    private final double rate;
    private final double capacity;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;

    private double tokens;
    private long lastRefillNanos;

    /**
     * Erstellt einen vollen Bucket mit Kapazität {@code max(1, rate)}.
     *
     * @param rate Tokens pro Sekunde (größer 0)
     */
    public TokenBucket(double rate) {
        this(rate, Math.max(1.0, rate));
    }

    public TokenBucket(double rate, double capacity) {
        this(rate, capacity, System::nanoTime, TokenBucket::sleepMillis);
    }

    /**
     * Erstellt den Bucket mit expliziter Zeitquelle (nützlich für Tests).
     *
     * @param rate     Tokens pro Sekunde (größer 0)
     * @param capacity maximale Anzahl gespeicherter Tokens (mindestens 1)
     * @param nanoTime monotone Zeitquelle in Nanosekunden
     * @param sleeper  Warte-Strategie zwischen zwei Polls
     */
    TokenBucket(double rate, double capacity, LongSupplier nanoTime, Sleeper sleeper) {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("rate must be a positive finite number: " + rate);
        }
        if (!(capacity >= 1) || Double.isInfinite(capacity)) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        this.rate = rate;
        this.capacity = capacity;
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    public double rate() {
        return rate;
    }

    public double capacity() {
        return capacity;
    }

    @Override
    public void acquire(int permits) {
        checkPermits(permits);
        while (!tryAcquire(permits)) {
            try {
                sleeper.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitInterruptedException("interrupted while waiting for " + permits + " token(s)", e);
            }
        }
    }

    @Override
    public synchronized boolean tryAcquire(int permits) {
        checkPermits(permits);
        refill();
        if (tokens >= permits) {
            tokens -= permits;
            return true;
        }
        return false;
    }

    /**
     * Aktueller Token-Stand (nach Nachfüllen), für Diagnose und Tests.
     *
     * @return verfügbare Tokens
     */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) return;
        tokens = Math.min(capacity, tokens + (elapsed / 1_000_000_000.0) * rate);
        lastRefillNanos = now;
    }

    private void checkPermits(int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be >= 1: " + permits);
        }
        if (permits > capacity) {
            throw new IllegalArgumentException("permits " + permits + " exceed bucket capacity " + capacity);
        }
    }

    private static void sleepMillis(long millis) throws InterruptedException {
        TimeUnit.MILLISECONDS.sleep(millis);
    }

    /** Warte-Strategie zwischen zwei Polls. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
