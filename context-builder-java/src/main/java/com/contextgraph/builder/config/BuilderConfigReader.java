package com.contextgraph.builder.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

public class BuilderConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a builder configuration file.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public BuilderConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile())) {
            BuilderConfig config = GSON.fromJson(reader, BuilderConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return config;
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
