package com.ttennebkram.trackpipe.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.trackpipe.ui.SurfaceOptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Engine and window settings.
 *
 * Defaults come from the classpath resource {@value #DEFAULTS_RESOURCE}; a
 * user file may override any subset of fields:
 * <pre>
 * {
 *   "pollTimeoutMs": 1,
 *   "cancelKey": "ESCAPE",
 *   "surface": { "resizable": true, "keepRatio": true, "expandedControls": true, "maxImageWidth": 800 }
 * }
 * </pre>
 */
public class TrackpipeConfig {

    public static final String DEFAULTS_RESOURCE = "/trackpipe-defaults.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private long pollTimeoutMs = 1;
    private String cancelKey = "ESCAPE";
    private Surface surface = new Surface();

    /**
     * Settings for each window's display surface.
     */
    public static class Surface {
        private boolean resizable = true;
        private boolean keepRatio = true;
        private boolean expandedControls = true;
        private int maxImageWidth = 800;
    }

    /**
     * Settings from the bundled defaults resource, or the built-in values if
     * the resource is missing.
     */
    public static TrackpipeConfig defaults() throws IOException {
        JsonObject base = readDefaults();
        return fromJson(base, DEFAULTS_RESOURCE);
    }

    /**
     * Defaults overridden by the fields present in {@code userFile}.
     *
     * @throws IOException if the file cannot be read or is not a valid config
     */
    public static TrackpipeConfig load(Path userFile) throws IOException {
        JsonObject merged = readDefaults();
        merge(merged, readObject(userFile));
        return fromJson(merged, userFile.toString());
    }

    private static JsonObject readDefaults() throws IOException {
        try (InputStream in = TrackpipeConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                return GSON.toJsonTree(new TrackpipeConfig()).getAsJsonObject();
            }
            return parseObject(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        }
    }

    private static JsonObject readObject(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parseObject(reader, file.toString());
        }
    }

    private static JsonObject parseObject(Reader reader, String source) throws IOException {
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new IOException("Invalid config " + source + ": not a JSON object");
            }
            return parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid config " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Copy {@code override} into {@code base}, descending into nested objects.
     */
    static void merge(JsonObject base, JsonObject override) {
        for (Map.Entry<String, JsonElement> entry : override.entrySet()) {
            JsonElement existing = base.get(entry.getKey());
            if (existing != null && existing.isJsonObject() && entry.getValue().isJsonObject()) {
                merge(existing.getAsJsonObject(), entry.getValue().getAsJsonObject());
            } else {
                base.add(entry.getKey(), entry.getValue());
            }
        }
    }

    private static TrackpipeConfig fromJson(JsonObject json, String source) throws IOException {
        TrackpipeConfig config;
        try {
            config = GSON.fromJson(json, TrackpipeConfig.class);
        } catch (JsonParseException | NumberFormatException e) {
            throw new IOException("Invalid config " + source + ": " + e.getMessage(), e);
        }
        if (config.surface == null) {
            config.surface = new Surface();
        }
        if (config.pollTimeoutMs < 1) {
            throw new IOException("Invalid config " + source + ": pollTimeoutMs must be at least 1");
        }
        if (config.cancelKey == null || config.cancelKey.isBlank()) {
            throw new IOException("Invalid config " + source + ": cancelKey must not be empty");
        }
        return config;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public String getCancelKey() {
        return cancelKey;
    }

    public SurfaceOptions toSurfaceOptions() {
        return new SurfaceOptions(surface.resizable, surface.keepRatio, surface.expandedControls, surface.maxImageWidth);
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
