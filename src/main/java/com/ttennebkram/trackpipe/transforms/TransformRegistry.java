package com.ttennebkram.trackpipe.transforms;

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Registry of the stock OpenCV transforms by type name.
 * Used by pipeline declaration files and the transform listing.
 *
 * Registration is an explicit table; adding a transform means adding a line here.
 */
public class TransformRegistry {

    private static final Map<String, Function<JsonObject, MatTransform>> FACTORIES = new LinkedHashMap<>();

    static {
        register("FileSource", options -> new FileSourceTransform(getString(options, "path", null)));
        registerSimple("Grayscale", GrayscaleTransform::new);
        registerSimple("Invert", InvertTransform::new);
        registerSimple("GaussianBlur", GaussianBlurTransform::new);
        registerSimple("MedianBlur", MedianBlurTransform::new);
        registerSimple("BoxBlur", BoxBlurTransform::new);
        registerSimple("CannyEdge", CannyEdgeTransform::new);
        registerSimple("Threshold", ThresholdTransform::new);
        registerSimple("AdaptiveThreshold", AdaptiveThresholdTransform::new);
        registerSimple("Dilate", DilateTransform::new);
        registerSimple("Erode", ErodeTransform::new);
        registerSimple("Gain", GainTransform::new);
    }

    private TransformRegistry() {
    }

    private static void register(String type, Function<JsonObject, MatTransform> factory) {
        FACTORIES.put(type, factory);
    }

    private static void registerSimple(String type, Supplier<MatTransform> factory) {
        FACTORIES.put(type, options -> factory.get());
    }

    /**
     * Registered type names in registration order.
     */
    public static Set<String> getTypes() {
        return Collections.unmodifiableSet(FACTORIES.keySet());
    }

    public static boolean isRegistered(String type) {
        return FACTORIES.containsKey(type);
    }

    /**
     * Create a new transform of {@code type}.
     *
     * @param options type-specific settings (e.g. "path" for FileSource), may be empty
     * @throws IllegalArgumentException if the type is unknown or the options are invalid
     */
    public static MatTransform create(String type, JsonObject options) {
        Function<JsonObject, MatTransform> factory = FACTORIES.get(type);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown transform type '" + type + "'. Known types: " + FACTORIES.keySet());
        }
        return factory.apply(options != null ? options : new JsonObject());
    }

    private static String getString(JsonObject json, String key, String defaultValue) {
        if (json.has(key) && json.get(key).isJsonPrimitive()) {
            return json.get(key).getAsString();
        }
        return defaultValue;
    }
}
