package com.ttennebkram.trackpipe.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.trackpipe.model.PipelineItem;
import com.ttennebkram.trackpipe.model.Transform;
import com.ttennebkram.trackpipe.model.Window;
import com.ttennebkram.trackpipe.model.WindowNamer;
import com.ttennebkram.trackpipe.transforms.TransformRegistry;
import org.opencv.core.Mat;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a pipeline declaration from JSON.
 *
 * Each entry of "items" is either a transform or a window of transforms:
 * <pre>
 * { "items": [
 *     { "name": "Blur", "transforms": [ { "type": "Grayscale" }, { "type": "GaussianBlur" } ] },
 *     { "transforms": [ { "type": "CannyEdge" } ] }
 * ] }
 * </pre>
 * Transform entries name a type from {@link TransformRegistry}; any other
 * fields are passed to the transform as options. The items are returned as
 * declared - grouping and label checks happen when the engine assembles them.
 */
public class PipelineDefinitionLoader {

    private final WindowNamer namer;

    public PipelineDefinitionLoader() {
        this(WindowNamer.shared());
    }

    public PipelineDefinitionLoader(WindowNamer namer) {
        this.namer = namer;
    }

    public List<PipelineItem<Mat>> load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader, file.toString());
        }
    }

    public List<PipelineItem<Mat>> parse(String json) throws IOException {
        return load(new StringReader(json), "<string>");
    }

    private List<PipelineItem<Mat>> load(Reader reader, String source) throws IOException {
        JsonObject root;
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new IOException("Invalid pipeline file " + source + ": not a JSON object");
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid pipeline file " + source + ": " + e.getMessage(), e);
        }

        if (!root.has("items") || !root.get("items").isJsonArray()) {
            throw new IOException("Invalid pipeline file " + source + ": missing 'items' array");
        }

        List<PipelineItem<Mat>> items = new ArrayList<>();
        JsonArray array = root.getAsJsonArray("items");
        for (int i = 0; i < array.size(); i++) {
            JsonObject item = asObject(array.get(i), source, "item " + i);
            if (item.has("transforms")) {
                items.add(readWindow(item, source, i));
            } else {
                items.add(readTransform(item, source, "item " + i));
            }
        }
        return items;
    }

    private Window<Mat> readWindow(JsonObject json, String source, int index) throws IOException {
        String name = json.has("name") ? readString(json, "name", source, "item " + index) : null;
        if (!json.get("transforms").isJsonArray()) {
            throw new IOException("Invalid pipeline file " + source + ": 'transforms' of item " + index + " is not an array");
        }
        JsonArray array = json.getAsJsonArray("transforms");
        List<Transform<Mat>> transforms = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            String where = "item " + index + " transform " + i;
            JsonObject entry = asObject(array.get(i), source, where);
            if (entry.has("transforms")) {
                throw new IOException("Invalid pipeline file " + source + ": " + where
                    + " is a window; windows may only contain transforms");
            }
            transforms.add(readTransform(entry, source, where));
        }
        return new Window<>(transforms, name, namer);
    }

    private Transform<Mat> readTransform(JsonObject json, String source, String where) throws IOException {
        if (!json.has("type")) {
            throw new IOException("Invalid pipeline file " + source + ": " + where + " has no 'type'");
        }
        String type = readString(json, "type", source, where);
        try {
            return TransformRegistry.create(type, json);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid pipeline file " + source + ": " + where + ": " + e.getMessage(), e);
        }
    }

    private static String readString(JsonObject json, String key, String source, String where) throws IOException {
        JsonElement value = json.get(key);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new IOException("Invalid pipeline file " + source + ": '" + key + "' of " + where + " is not a string");
        }
        return value.getAsString();
    }

    private static JsonObject asObject(JsonElement element, String source, String where) throws IOException {
        if (element == null || !element.isJsonObject()) {
            throw new IOException("Invalid pipeline file " + source + ": " + where + " is not a JSON object");
        }
        return element.getAsJsonObject();
    }
}
