package com.gofixture.cli.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class RenderConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a render.json file.
     *
     * @throws RenderConfigException if the file is missing, empty or malformed
     */
    public RenderConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new RenderConfigException("Render config not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            RenderConfig config = GSON.fromJson(reader, RenderConfig.class);
            if (config == null) {
                throw new RenderConfigException("Render config is empty: " + configPath);
            }
            return config;
        } catch (NoSuchFileException e) {
            throw new RenderConfigException("Render config not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new RenderConfigException("Malformed render config " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RenderConfigException("Failed to read render config " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class RenderConfigException extends RuntimeException {
        public RenderConfigException(String message) { super(message); }
        public RenderConfigException(String message, Throwable cause) { super(message, cause); }
    }
}
