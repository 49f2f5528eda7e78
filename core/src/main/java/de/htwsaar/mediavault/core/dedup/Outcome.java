package de.htwsaar.mediavault.core.dedup;

/** Endzustand eines Tasks. */
public enum Outcome {
    DOWNLOADED,
    SKIPPED,
    FAILED
}
