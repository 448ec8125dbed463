package com.callperf.daemon;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class DaemonConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes the daemon configuration file.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public DaemonConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Daemon config not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            DaemonConfig config = GSON.fromJson(reader, DaemonConfig.class);
            if (config == null) {
                throw new ConfigReadException("Daemon config is empty: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Daemon config is not valid JSON: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read daemon config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
