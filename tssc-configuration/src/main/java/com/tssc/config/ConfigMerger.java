package com.tssc.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure deep merge over ordered configuration layers. Later layers take precedence: a key present
 * in a later layer replaces the earlier value, except when both values are mappings, in which case
 * their keys are unioned and merged recursively by the same rule. Key presence decides, not
 * truthiness: an explicit null or empty string in a later layer still replaces.
 * <p>
 * Inputs are never mutated; the result shares no mutable container with any input.
 */
public final class ConfigMerger {

    private ConfigMerger() {
    }

    /**
     * Merges the given layers, lowest precedence first. Null layers are skipped.
     *
     * @param layers configuration layers, lowest precedence first
     * @return new merged mapping
     */
    public static Map<String, Object> deepMerge(List<? extends Map<String, ?>> layers) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (layers == null) return merged;
        for (Map<String, ?> layer : layers) {
            if (layer != null) {
                mergeInto(merged, layer);
            }
        }
        return merged;
    }

    /** Varargs form of {@link #deepMerge(List)}. */
    @SafeVarargs
    public static Map<String, Object> deepMerge(Map<String, ?>... layers) {
        return deepMerge(Arrays.asList(layers));
    }

    /**
     * Deep copy of a configuration tree: mappings and lists are copied recursively; leaves
     * (including {@link ConfigValue}s, which are immutable) are shared.
     */
    public static Object deepCopy(Object tree) {
        if (tree instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) tree).entrySet()) {
                copy.put(String.valueOf(e.getKey()), deepCopy(e.getValue()));
            }
            return copy;
        }
        if (tree instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) tree) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return tree;
    }

    /** Typed convenience for {@link #deepCopy(Object)} on a mapping; null becomes an empty mapping. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopy(Map<String, ?> tree) {
        if (tree == null) return new LinkedHashMap<>();
        return (Map<String, Object>) deepCopy((Object) tree);
    }

    @SuppressWarnings("unchecked")
    private static void mergeInto(Map<String, Object> target, Map<String, ?> layer) {
        for (Map.Entry<String, ?> e : layer.entrySet()) {
            Object existing = target.get(e.getKey());
            Object incoming = e.getValue();
            if (existing instanceof Map && incoming instanceof Map) {
                mergeInto((Map<String, Object>) existing, (Map<String, ?>) incoming);
            } else {
                target.put(e.getKey(), deepCopy(incoming));
            }
        }
    }
}
