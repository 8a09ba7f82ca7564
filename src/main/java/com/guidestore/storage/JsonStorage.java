package com.guidestore.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Small JSON sidecar files (archive audits, archive journal markers).
 */
public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static <T> Optional<T> readJson(Path path, Class<T> type) throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.ofNullable(mapper.readValue(path.toFile(), type));
    }

    public static void writeJson(Path path, Object data) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), data);
    }
}
