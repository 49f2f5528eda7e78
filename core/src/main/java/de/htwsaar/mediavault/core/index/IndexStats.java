package de.htwsaar.mediavault.core.index;

/**
 * Zählerstände des Index.
 *
 * @param urls         URL-Records
 * @param etags        ETag-Records
 * @param fingerprints Fingerprint-Records
 * @param paths        Pfad-Records
 * @param hashes       verschiedene Content-Hashes mit mindestens einem Pfad
 * @param failedUrls   Einträge der Fehlerliste
 */
public record IndexStats(long urls, long etags, long fingerprints, long paths, long hashes, long failedUrls) {}
