package de.htwsaar.mediavault.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Digest-Hilfsfunktionen für Content-Hashes und Teil-Fingerprints.
 *
 * <p>Content-Hash = MD5 über alle Bytes einer Datei, Fingerprint = SHA-256 über die ersten N Bytes.
 */
public final class DigestUtil {

    private static final int BUFFER_SIZE = 8 * 1024;

    private DigestUtil() {}

    public static String sha256Hex(byte[] data) {
        MessageDigest md = newDigest("SHA-256");
        return toHex(md.digest(data));
    }

    /**
     * Berechnet den MD5-Hash einer Datei, gestreamt in 8-KiB-Blöcken.
     *
     * @param file vollständig geschriebene Datei
     * @return Hex-Digest (Kleinbuchstaben)
     * @throws IOException wenn die Datei nicht gelesen werden kann
     */
    public static String md5Hex(Path file) throws IOException {
        MessageDigest md = newDigest("MD5");
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buf = new byte[BUFFER_SIZE];
            int n;
            while ((n = in.read(buf)) != -1) {
                md.update(buf, 0, n);
            }
        }
        return toHex(md.digest());
    }

    /**
     * SHA-256 über die ersten {@code length} Bytes einer Datei (oder die ganze Datei, falls kürzer).
     *
     * @param file   lokale Datei
     * @param length Anzahl Bytes am Dateianfang
     * @return Hex-Digest
     * @throws IOException wenn die Datei nicht gelesen werden kann
     */
    public static String sha256PrefixHex(Path file, int length) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return sha256Hex(in.readNBytes(Math.max(0, length)));
        }
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute " + algorithm, e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
