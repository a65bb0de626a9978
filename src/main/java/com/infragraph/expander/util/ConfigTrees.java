package com.infragraph.expander.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the nested attribute trees ({@code Map}/{@code List}/scalar) that make up
 * a block's configuration.
 */
public class ConfigTrees {

    private static final Pattern INTERPOLATION = Pattern.compile("\\$\\{([^}]*)}");

    private static final List<String> REFERENCE_PREFIXES = List.of(
            "var.", "local.", "module.", "each.", "count.", "data.", "self."
    );

    private ConfigTrees() {
        // Utility class
    }

    /**
     * Value copy of a configuration tree. Maps and lists are rebuilt, every other
     * value is treated as immutable and shared.
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(e.getKey(), deepCopy(e.getValue()));
            }
            return (T) copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(deepCopy(item));
            }
            return (T) copy;
        }
        return value;
    }

    /**
     * Read-only value copy of a configuration tree, for values used as identities.
     */
    public static Object immutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(e.getKey(), immutableCopy(e.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(immutableCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Applies {@code fn} to every leaf of the tree, rebuilding containers in place.
     * Keys are left untouched.
     */
    @SuppressWarnings("unchecked")
    public static Object transformLeaves(Object value, UnaryOperator<Object> fn) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> target = (Map<Object, Object>) map;
            for (Map.Entry<Object, Object> e : target.entrySet()) {
                e.setValue(transformLeaves(e.getValue(), fn));
            }
            return target;
        }
        if (value instanceof List<?> list) {
            List<Object> target = (List<Object>) list;
            for (int i = 0; i < target.size(); i++) {
                target.set(i, transformLeaves(target.get(i), fn));
            }
            return target;
        }
        return fn.apply(value);
    }

    /**
     * Replaces iteration placeholders inside a tree.
     *
     * A string that is exactly one placeholder ({@code each.value} or {@code ${each.value}})
     * is replaced by a copy of the typed value; {@code each.value.a.b} navigates into a mapping value.
     * Placeholders embedded in a longer string are replaced textually.
     */
    public static Object substitute(Object tree, Map<String, Object> replacements) {
        if (replacements.isEmpty()) {
            return tree;
        }
        List<String> names = replacements.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        return transformLeaves(tree, leaf -> leaf instanceof String s ? substituteString(s, names, replacements) : leaf);
    }

    private static Object substituteString(String s, List<String> names, Map<String, Object> replacements) {
        String expression = unwrapInterpolation(s);
        if (expression != null) {
            Lookup whole = lookup(expression, names, replacements);
            if (whole.found()) {
                return deepCopy(whole.value());
            }
        }
        if (!s.contains("${")) {
            return s;
        }
        Matcher m = INTERPOLATION.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Lookup embedded = lookup(m.group(1).trim(), names, replacements);
            String text = embedded.found() ? String.valueOf(embedded.value()) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(text));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static Lookup lookup(String expression, List<String> names, Map<String, Object> replacements) {
        for (String name : names) {
            if (expression.equals(name)) {
                return new Lookup(true, replacements.get(name));
            }
            if (expression.startsWith(name + ".")) {
                Object current = replacements.get(name);
                for (String segment : expression.substring(name.length() + 1).split("\\.")) {
                    if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                        return Lookup.MISSING;
                    }
                    current = map.get(segment);
                }
                return new Lookup(true, current);
            }
        }
        return Lookup.MISSING;
    }

    /**
     * Returns the bare expression of a whole-string reference, or {@code null} if the
     * string mixes literal text with interpolation.
     */
    public static String unwrapInterpolation(String s) {
        String trimmed = s.trim();
        if (trimmed.startsWith("${") && trimmed.endsWith("}") && trimmed.indexOf("${", 2) < 0) {
            return trimmed.substring(2, trimmed.length() - 1).trim();
        }
        return trimmed.contains("${") ? null : trimmed;
    }

    /**
     * Whether a string still refers to something that has not been evaluated.
     */
    public static boolean isUnresolvedReference(String s) {
        if (s.contains("${")) {
            return true;
        }
        String trimmed = s.trim();
        return REFERENCE_PREFIXES.stream().anyMatch(trimmed::startsWith);
    }

    /**
     * Whether no leaf of the tree is an unresolved reference.
     */
    public static boolean isResolved(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return !isUnresolvedReference(s);
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().allMatch(v -> v == null || isResolved(v));
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().allMatch(v -> v == null || isResolved(v));
        }
        return true;
    }

    private record Lookup(boolean found, Object value) {
        static final Lookup MISSING = new Lookup(false, null);
    }
}
