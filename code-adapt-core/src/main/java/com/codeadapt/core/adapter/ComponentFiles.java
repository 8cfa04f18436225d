package com.codeadapt.core.adapter;

import com.codeadapt.core.model.AdaptationPlan;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.TargetContext;
import com.codeadapt.core.util.Identifiers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads adapter inputs from files and writes results as JSON.
 *
 * <p>A component file is either a JSON {@link Component} ({@code .json}) or plain source,
 * in which case the component id is the file name without extension and the name is that
 * id in PascalCase.
 */
public final class ComponentFiles {

    private static final Logger log = LoggerFactory.getLogger(ComponentFiles.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ComponentFiles() {
        // Utility class - no instantiation
    }

    public static Component readComponent(Path path) {
        String fileName = path.getFileName().toString();
        if (fileName.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return read(path, Component.class);
        }
        String source = readString(path);
        int dot = fileName.lastIndexOf('.');
        String id = dot > 0 ? fileName.substring(0, dot) : fileName;
        List<String> words = Identifiers.split(id);
        String name = words.isEmpty() ? id : NamingConvention.PASCAL_CASE.join(words);
        String language = fileName.endsWith(".ts") ? "typescript" : "javascript";
        log.debug("Read component '{}' from source file {}", id, path);
        return new Component(id, name, source, language, null, null, null, null, null, null);
    }

    public static TargetContext readTarget(Path path) {
        return read(path, TargetContext.class);
    }

    public static AdaptationPlan readPlan(Path path) {
        return read(path, AdaptationPlan.class);
    }

    public static Map<String, String> readCustomizations(Path path) {
        try {
            return JSON_MAPPER.readValue(path.toFile(), new TypeReference<Map<String, String>>() { });
        } catch (IOException e) {
            throw new ComponentLoadException("Failed to read customizations from " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a value as indented JSON.
     */
    public static String toJson(Object value) {
        try {
            return JSON_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(Path path, Class<T> type) {
        try {
            T value = JSON_MAPPER.readValue(path.toFile(), type);
            log.debug("Read {} from {}", type.getSimpleName(), path);
            return value;
        } catch (IOException e) {
            throw new ComponentLoadException("Failed to read " + type.getSimpleName() + " from " + path + ": " + e.getMessage(), e);
        }
    }

    private static String readString(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new ComponentLoadException("Failed to read component source " + path + ": " + e.getMessage(), e);
        }
    }
}
