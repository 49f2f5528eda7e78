package de.htwsaar.mediavault.core.index;

/**
 * Fachliche Exception für nicht verfügbare oder fehlerhafte Index-Zugriffe.
 * Aufrufer im Entscheidungspfad behandeln sie als "keine Information".
 */
public class IndexAccessException extends RuntimeException {

    public IndexAccessException(String message) {
        super(message);
    }

    public IndexAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
