package de.htwsaar.mediavault.core.ratelimit;

/**
 * Zugangskontrolle für ausgehende Requests.
 * Alle Netzwerkaufrufe eines Laufs teilen sich eine Instanz, damit die Gesamtrate begrenzt ist.
 */
public interface RateLimiter {

    /**
     * Blockiert, bis {@code permits} Tokens verfügbar sind, und verbraucht sie.
     *
     * @param permits Anzahl Tokens (mindestens 1)
     * @throws RateLimitInterruptedException wenn der Thread beim Warten unterbrochen wird
     */
    void acquire(int permits);

    /** Verbraucht ein Token, blockiert bei Bedarf. */
    default void acquire() {
        acquire(1);
    }

    /**
     * Versucht, {@code permits} Tokens ohne Warten zu verbrauchen.
     *
     * @param permits Anzahl Tokens
     * @return {@code true} wenn die Tokens verbraucht wurden
     */
    boolean tryAcquire(int permits);

    /**
     * Limiter ohne Begrenzung, z. B. für Wartungsläufe ohne Netzwerklast.
     *
     * @return Limiter, der jede Anfrage sofort zulässt
     */
    static RateLimiter unlimited() {
        return new RateLimiter() {
            @Override
            public void acquire(int permits) {
                // keine Begrenzung
            }

            @Override
            public boolean tryAcquire(int permits) {
                return true;
            }
        };
    }
}
