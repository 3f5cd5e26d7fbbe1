package io.coolchords.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.coolchords.exceptions.PresetParseException;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads JSON documents from the classpath or the file system
 */
public class JsonIo {
    private static final Gson GSON = new GsonBuilder()
            .enableComplexMapKeySerialization()
            .create();

    private JsonIo() {}

    /**
     * @param resourcePath Path relative to the classpath root, e.g. "chord_filter_presets.json"
     * @throws PresetParseException When the resource is missing or not valid JSON for the type
     */
    public static <T> T readResource(String resourcePath, TypeToken<T> typeToken) {
        try (InputStream inputStream = JsonIo.class.getResourceAsStream("/" + resourcePath)) {
            if (inputStream == null)
                throw new PresetParseException("Resource not found: " + resourcePath);
            return read(inputStream, typeToken, resourcePath);
        } catch (IOException e) {
            throw new PresetParseException("Could not read resource: " + resourcePath, e);
        }
    }

    /**
     * @throws PresetParseException When the file is missing or not valid JSON for the type
     */
    public static <T> T readFile(File file, TypeToken<T> typeToken) {
        try (InputStream inputStream = new FileInputStream(file)) {
            return read(inputStream, typeToken, file.getAbsolutePath());
        } catch (IOException e) {
            throw new PresetParseException("Could not read file: " + file.getAbsolutePath(), e);
        }
    }

    private static <T> T read(InputStream inputStream, TypeToken<T> typeToken, String source) throws IOException {
        try (InputStreamReader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            T value = GSON.fromJson(reader, typeToken);
            if (value == null)
                throw new PresetParseException("Empty JSON document: " + source);
            return value;
        } catch (JsonParseException e) {
            throw new PresetParseException("Malformed JSON in " + source + ": " + e.getMessage(), e);
        }
    }
}
