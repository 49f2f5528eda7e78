package de.htwsaar.mediavault.core.ratelimit;

/**
 * Wird geworfen, wenn ein Thread beim Warten auf Tokens unterbrochen wurde.
 * Das Interrupt-Flag ist beim Werfen bereits wiederhergestellt.
 */
public class RateLimitInterruptedException extends RuntimeException {

    public RateLimitInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
