package de.htwsaar.mediavault.core.index;

import java.time.Instant;

/**
 * Eintrag der persistenten Fehlerliste.
 *
 * @param url          fehlgeschlagene URL
 * @param reason       letzter Fehlergrund
 * @param attempts     Anzahl registrierter Fehlschläge
 * @param lastFailedAt Zeitpunkt des letzten Fehlschlags
 */
public record FailedUrl(String url, String reason, int attempts, Instant lastFailedAt) {}
