package de.htwsaar.mediavault.core.fetch;

/** Lädt eine Ressource vollständig herunter. Fehler werden als Ergebnis gemeldet, nie geworfen. */
public interface Fetcher {

    FetchResult fetch(FetchRequest request);
}
