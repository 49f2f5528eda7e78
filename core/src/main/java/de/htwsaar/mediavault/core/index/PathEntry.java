package de.htwsaar.mediavault.core.index;

import java.nio.file.Path;

/** Eine Zeile der Hash-zu-Pfad-Zuordnung. */
public record PathEntry(String hash, Path path) {}
