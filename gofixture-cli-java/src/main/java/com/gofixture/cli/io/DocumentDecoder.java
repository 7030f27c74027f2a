package com.gofixture.cli.io;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonStreamParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reads a stream of concatenated JSON documents.
 *
 * With a target class every document is bound to it through Gson; without one the raw
 * {@link JsonElement} trees are returned. JSON {@code null} documents are skipped.
 */
public class DocumentDecoder {

    private final Gson gson;

    public DocumentDecoder() {
        this(new Gson());
    }

    public DocumentDecoder(Gson gson) {
        this.gson = gson;
    }

    public List<Object> decode(Path input, Class<?> type) {
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            return decode(reader, type, input.toString());
        } catch (NoSuchFileException e) {
            throw new DecodeException("Input not found: " + input, e);
        } catch (IOException e) {
            throw new DecodeException("Failed to read " + input + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param type   class to bind each document to, or {@code null} for raw trees
     * @param source name used in error messages
     */
    public List<Object> decode(Reader reader, Class<?> type, String source) {
        List<Object> documents = new ArrayList<>();
        JsonStreamParser parser = new JsonStreamParser(reader);
        int index = 0;
        try {
            while (parser.hasNext()) {
                JsonElement element = parser.next();
                index++;
                if (element.isJsonNull()) {
                    continue;
                }
                documents.add(type == null ? element : gson.fromJson(element, type));
            }
        } catch (JsonParseException e) {
            throw new DecodeException("Malformed document #" + (index + 1) + " in " + source + ": " + e.getMessage(), e);
        } catch (NoSuchElementException e) {
            // the stream parser reports a document cut off by end of input this way
            throw new DecodeException("Truncated document #" + (index + 1) + " in " + source, e);
        }
        return documents;
    }

    public static class DecodeException extends RuntimeException {
        public DecodeException(String message, Throwable cause) { super(message, cause); }
    }
}
