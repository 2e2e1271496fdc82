package com.mimecast.listrunner.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration file foundation.
 *
 * <p>Reads JSON5 styled files (comments, unquoted keys, single quotes) with Gson in lenient mode.
 */
public class ConfigFoundation extends BasicConfig {

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance from file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(read(Path.of(path)));
    }

    /**
     * Reads a configuration file into a map.
     *
     * @param path Path to configuration file.
     * @return Map instance.
     * @throws IOException Unable to read or parse file.
     */
    public static Map<String, Object> read(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return parse(content, path.toString());
    }

    /**
     * Parses configuration text into a map.
     *
     * @param content Configuration text.
     * @param source  Source name for error reporting.
     * @return Map instance.
     * @throws IOException Unable to parse content.
     */
    public static Map<String, Object> parse(String content, String source) throws IOException {
        try {
            Map<String, Object> map = new Gson().fromJson(content, new TypeToken<Map<String, Object>>() {
            }.getType());
            return map != null ? map : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }
}
