package com.gofixture.cli.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rendered Go source to disk as UTF-8, creating parent directories as needed.
 */
public class FixtureWriter {

    public static class WriteException extends RuntimeException {
        public WriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    public void write(Path target, String text) {
        Path parent = target.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new WriteException("Could not create output directory: " + parent, e);
        }
        try {
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WriteException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        System.err.println("[gofixture-cli] written: " + target);
    }
}
