package de.htwsaar.mediavault.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class JacksonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        // register the module
        MAPPER.registerModule(new JavaTimeModule());
        MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private JacksonCodec() {
        // Utility
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new MediaVaultSerializationException("Failed to serialize object to the JSON format !", e);
        }
    }

    public static String toPrettyJson(Object obj) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new MediaVaultSerializationException("Failed to serialize object to the JSON format !", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new MediaVaultSerializationException(
                    "Failed to deserialize JSON format to : [" + clazz.getSimpleName() + "]", e);
        }
    }

    /**
     * Liest eine JSON-Datei vollständig in den Zieltyp.
     *
     * @param file  JSON-Datei
     * @param clazz Zieltyp
     * @return deserialisiertes Objekt
     * @throws MediaVaultSerializationException bei I/O- oder Formatfehlern
     */
    public static <T> T readFile(Path file, Class<T> clazz) {
        try {
            return MAPPER.readValue(file.toFile(), clazz);
        } catch (IOException e) {
            throw new MediaVaultSerializationException(
                    "Failed to read JSON file " + file + " as : [" + clazz.getSimpleName() + "]", e);
        }
    }

    /**
     * Schreibt ein Objekt pretty-printed als JSON-Datei; Elternverzeichnisse werden angelegt.
     *
     * @param file Zieldatei
     * @param obj  zu schreibendes Objekt
     * @throws MediaVaultSerializationException bei I/O- oder Formatfehlern
     */
    public static void writeFile(Path file, Object obj) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), obj);
        } catch (IOException e) {
            throw new MediaVaultSerializationException("Failed to write JSON file " + file, e);
        }
    }
}
