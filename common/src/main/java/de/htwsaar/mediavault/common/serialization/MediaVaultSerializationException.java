package de.htwsaar.mediavault.common.serialization;

public class MediaVaultSerializationException extends RuntimeException {

    public MediaVaultSerializationException(String message) {

        super(message);
    }

    public MediaVaultSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
