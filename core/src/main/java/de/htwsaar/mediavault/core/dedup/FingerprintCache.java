package de.htwsaar.mediavault.core.dedup;

import de.htwsaar.mediavault.common.util.DigestUtil;
import de.htwsaar.mediavault.core.index.PathEntry;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Lauf-lokaler Speicher der Teil-Fingerprints bereits indexierter Dateien (Hash → Fingerprint).
 * Gehört der {@link DedupEngine}; jede Datei wird pro Lauf höchstens einmal angelesen.
 */
public final class FingerprintCache {

    private final int prefixBytes;
    private final ConcurrentMap<String, String> byHash = new ConcurrentHashMap<>();

    public FingerprintCache(int prefixBytes) {
        if (prefixBytes < 1) {
            throw new IllegalArgumentException("prefixBytes must be >= 1: " + prefixBytes);
        }
        this.prefixBytes = prefixBytes;
    }

    /**
     * Sucht eine indexierte Datei mit gleichem Fingerprint.
     *
     * @param fingerprint Fingerprint der entfernten Ressource
     * @param entries     Index-Einträge
     * @return erster Treffer mit existierender Datei
     */
    public Optional<PathEntry> findMatch(String fingerprint, Iterable<PathEntry> entries) {
        for (PathEntry e : entries) {
            Optional<String> local = fingerprintOf(e);
            if (local.isPresent() && local.get().equals(fingerprint) && Files.exists(e.path())) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    Optional<String> fingerprintOf(PathEntry entry) {
        String cached = byHash.get(entry.hash());
        if (cached != null) return Optional.of(cached);
        if (!Files.isRegularFile(entry.path())) return Optional.empty();
        try {
            String fp = DigestUtil.sha256PrefixHex(entry.path(), prefixBytes);
            String prev = byHash.putIfAbsent(entry.hash(), fp);
            return Optional.of(prev != null ? prev : fp);
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    public int size() {
        return byHash.size();
    }

    public void clear() {
        byHash.clear();
    }
}
