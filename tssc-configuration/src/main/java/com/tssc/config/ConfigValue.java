package com.tssc.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A configuration leaf value plus where it came from: the source that supplied it (a pipeline
 * definition name, {@code runtime-override}, ...) and the path of keys and list indexes that lead
 * to it inside that source. Mappings and lists are plain containers whose leaves are ConfigValues.
 * <p>
 * The wrapper is optional everywhere: {@link #unwrapForValue(Object)} and
 * {@link #convertLeavesToValues(Object)} accept plain values and return them unchanged.
 */
public final class ConfigValue {

    private final Object value;
    private final String source;
    private final List<Object> pathParts;

    public ConfigValue(Object value, String source, List<Object> pathParts) {
        this.value = value;
        this.source = source;
        this.pathParts = pathParts != null
                ? Collections.unmodifiableList(new ArrayList<>(pathParts))
                : Collections.emptyList();
    }

    public ConfigValue(Object value) {
        this(value, null, null);
    }

    /**
     * Plain value of this leaf. When the wrapped value is itself a mapping or list, a converted copy
     * with every nested ConfigValue unwrapped is returned.
     */
    public Object getValue() {
        return convertLeavesToValues(value);
    }

    /** Raw wrapped value, without converting nested containers. */
    public Object getRawValue() {
        return value;
    }

    /** Source that supplied this value; null when unknown. */
    public String getSource() {
        return source;
    }

    /** Keys and list indexes leading to this value inside its source. Never null. */
    public List<Object> getPathParts() {
        return pathParts;
    }

    /**
     * Recursively strips provenance from a configuration tree. Mappings and lists are copied;
     * ConfigValues are replaced by their plain values; anything else is returned as is.
     *
     * @param tree configuration tree, a single ConfigValue, or plain data (may be null)
     * @return plain nested structure of maps, lists and scalars
     */
    public static Object convertLeavesToValues(Object tree) {
        if (tree instanceof ConfigValue) {
            return convertLeavesToValues(((ConfigValue) tree).value);
        }
        if (tree instanceof Map) {
            Map<String, Object> plain = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) tree).entrySet()) {
                plain.put(String.valueOf(e.getKey()), convertLeavesToValues(e.getValue()));
            }
            return plain;
        }
        if (tree instanceof List) {
            List<Object> plain = new ArrayList<>();
            for (Object item : (List<?>) tree) {
                plain.add(convertLeavesToValues(item));
            }
            return plain;
        }
        return tree;
    }

    /**
     * Typed convenience for {@link #convertLeavesToValues(Object)} on a mapping.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> convertLeavesToValues(Map<String, ?> tree) {
        return tree == null ? null : (Map<String, Object>) convertLeavesToValues((Object) tree);
    }

    /**
     * Returns the plain value of a ConfigValue, or the argument itself when it is not wrapped.
     */
    public static Object unwrapForValue(Object valueOrPlain) {
        if (valueOrPlain instanceof ConfigValue) {
            return ((ConfigValue) valueOrPlain).getValue();
        }
        return valueOrPlain;
    }

    /**
     * Wraps every leaf of a plain tree in a ConfigValue recording {@code source} and the leaf's path.
     * Leaves that already are ConfigValues keep their own provenance.
     *
     * @param tree      plain tree (map, list or scalar)
     * @param source    source name for the new leaves
     * @param pathParts path of the tree's root inside the source; null for the source root
     * @return tree of the same shape with ConfigValue leaves
     */
    public static Object convertLeavesToConfigValues(Object tree, String source, List<Object> pathParts) {
        List<Object> path = pathParts != null ? pathParts : Collections.emptyList();
        if (tree instanceof ConfigValue) {
            return tree;
        }
        if (tree instanceof Map) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) tree).entrySet()) {
                String key = String.valueOf(e.getKey());
                wrapped.put(key, convertLeavesToConfigValues(e.getValue(), source, append(path, key)));
            }
            return wrapped;
        }
        if (tree instanceof List) {
            List<?> items = (List<?>) tree;
            List<Object> wrapped = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                wrapped.add(convertLeavesToConfigValues(items.get(i), source, append(path, i)));
            }
            return wrapped;
        }
        return new ConfigValue(tree, source, path);
    }

    /** Typed convenience for {@link #convertLeavesToConfigValues(Object, String, List)} on a mapping. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> convertLeavesToConfigValues(Map<String, ?> tree, String source,
                                                                  List<Object> pathParts) {
        if (tree == null) return new LinkedHashMap<>();
        return (Map<String, Object>) convertLeavesToConfigValues((Object) tree, source, pathParts);
    }

    private static List<Object> append(List<Object> path, Object part) {
        List<Object> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(part);
        return extended;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConfigValue that = (ConfigValue) o;
        return Objects.equals(value, that.value)
                && Objects.equals(source, that.source)
                && Objects.equals(pathParts, that.pathParts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, source, pathParts);
    }

    @Override
    public String toString() {
        return "ConfigValue{value=" + value + ", source=" + source + ", pathParts=" + pathParts + "}";
    }
}
