package de.htwsaar.mediavault.core.index;

/** Art einer mit einem Content-Hash verknüpften Kennung. */
public enum IdentifierKind {
    URL,
    ETAG,
    FINGERPRINT
}
