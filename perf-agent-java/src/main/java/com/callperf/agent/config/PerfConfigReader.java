package com.callperf.agent.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class PerfConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a JSON configuration file.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public PerfConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            PerfConfig config = GSON.fromJson(reader, PerfConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Parses configuration from an in-memory JSON document. */
    public PerfConfig parse(String json) {
        try {
            PerfConfig config = GSON.fromJson(json, PerfConfig.class);
            return config != null ? config : PerfConfig.defaults();
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config is not valid JSON", e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
