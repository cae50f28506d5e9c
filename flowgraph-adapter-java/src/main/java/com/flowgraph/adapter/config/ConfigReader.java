package com.flowgraph.adapter.config;

import com.flowgraph.engine.tree.GrammarProfile;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the optional pipeline configuration file and checks the parts the stages rely on:
 * non-empty suffixes and extensions, and grammar profiles that can find functions.
 */
public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads, deserializes and validates a pipeline configuration file.
     * Profile keys are lower-cased so they match source extensions case-insensitively.
     *
     * @throws ConfigReadException if the file is missing, empty, malformed or fails validation
     */
    public PipelineConfig read(Path configPath) {
        PipelineConfig config;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, PipelineConfig.class);
        } catch (NoSuchFileException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config file " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty: " + configPath);
        }
        validate(config, configPath);
        return config;
    }

    void validate(PipelineConfig config, Path configPath) {
        for (String ext : config.getSourceExtensions()) {
            if (ext == null || ext.isBlank()) {
                throw new ConfigReadException("Blank entry in source_extensions of " + configPath);
            }
        }
        if (config.getAstSuffix().isEmpty() || config.getCfgInputSuffix().isEmpty()) {
            throw new ConfigReadException("ast_suffix and cfg_input_suffix must not be empty in " + configPath);
        }

        Map<String, ProfileConfig> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, ProfileConfig> entry : config.getProfiles().entrySet()) {
            String ext = entry.getKey().toLowerCase(Locale.ROOT);
            ProfileConfig profile = entry.getValue();
            if (profile == null) {
                throw new ConfigReadException("Profile '" + entry.getKey() + "' is empty in " + configPath);
            }
            if (profile.getBase() != null && GrammarProfile.named(profile.getBase()) == null) {
                throw new ConfigReadException("Profile '" + entry.getKey() + "' extends unknown grammar '"
                        + profile.getBase() + "' in " + configPath);
            }
            if (profile.getBase() == null && !profile.declaresFunctionKinds()) {
                throw new ConfigReadException("Profile '" + entry.getKey()
                        + "' declares no function_kinds and no base in " + configPath);
            }
            if (normalized.put(ext, profile) != null) {
                throw new ConfigReadException("Profile '" + ext + "' is declared twice (keys differ only in case) in "
                        + configPath);
            }
        }
        config.setProfiles(normalized);
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
