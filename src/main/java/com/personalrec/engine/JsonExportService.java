package com.personalrec.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson-based JSON export for ranked results and embedding tables.
 */
public class JsonExportService {
    private static final Logger logger = LoggerFactory.getLogger(JsonExportService.class);

    private final ObjectMapper mapper;

    public JsonExportService() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serializes any value (records, lists, maps) to a JSON string.
     * @throws IOException if the value cannot be serialized
     */
    public String toJson(Object value) throws IOException {
        return mapper.writeValueAsString(value);
    }

    /**
     * Writes a value as pretty-printed JSON, creating parent directories as needed.
     * @param file Output file
     * @param value Value to write
     * @throws IOException if serialization or file writing fails
     */
    public void writeJson(Path file, Object value) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("Output path cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(file.toFile(), value);
        logger.info("Wrote JSON export: {}", file);
    }

    /**
     * Plain map view of an embedding table, in catalog order, suitable for serialization.
     */
    public static Map<String, double[]> embeddingsAsMap(EmbeddingTable table) {
        Map<String, double[]> out = new LinkedHashMap<>();
        for (String key : table.keys()) {
            table.get(key).ifPresent(vec -> out.put(key, vec));
        }
        return out;
    }
}
