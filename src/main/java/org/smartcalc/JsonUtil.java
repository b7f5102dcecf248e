package org.smartcalc;

import java.io.*;
import java.nio.file.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson mapper and the file/classpath plumbing around it.
 */
final class JsonUtil {
    static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonUtil() {}

    /**
     * Reads a JSON object from the classpath. Returns null when the resource does not exist.
     */
    static ObjectNode readClasspathObject(String resource) {
        try (InputStream in = JsonUtil.class.getResourceAsStream(resource)) {
            if (in == null) return null;
            return asObject(MAPPER.readTree(in), resource);
        } catch (IOException e) {
            throw new ConfigException("PARSE_ERROR: cannot read classpath " + resource + " - " + e.getMessage(), e);
        }
    }

    /**
     * Reads a JSON object from a file. Returns null when the file does not exist.
     */
    static ObjectNode readFileObject(Path file) {
        if (!Files.isRegularFile(file)) return null;
        try {
            return asObject(MAPPER.readTree(file.toFile()), file.toString());
        } catch (IOException e) {
            throw new ConfigException("PARSE_ERROR: cannot read " + file + " - " + e.getMessage(), e);
        }
    }

    static void writeObject(Path file, ObjectNode json) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), json);
        } catch (IOException e) {
            throw new ConfigException("IO_ERROR: cannot write to " + file + " - " + e.getMessage(), e);
        }
    }

    private static ObjectNode asObject(JsonNode node, String source) {
        if (node instanceof ObjectNode) return (ObjectNode) node;
        throw new ConfigException("PARSE_ERROR: " + source + " must be a JSON object");
    }
}
