package com.infragraph.expander.util;

/**
 * Naming conventions for multiplied blocks.
 *
 * Example: s3_module + "a" -> s3_module["a"], m + 2 -> m[2]
 */
public class InstanceNamingUtil {

    private InstanceNamingUtil() {
        // Utility class
    }

    /**
     * Strips an instance suffix, if any.
     */
    public static String baseName(String name) {
        if (name == null) {
            return null;
        }
        int bracket = name.indexOf('[');
        return bracket < 0 ? name : name.substring(0, bracket);
    }

    /**
     * Appends the instance key to a block name. String keys are quoted.
     */
    public static String instanceName(String name, Object instanceKey) {
        return baseName(name) + "[" + formatKey(instanceKey) + "]";
    }

    public static String formatKey(Object instanceKey) {
        if (instanceKey instanceof String s) {
            return "\"" + s + "\"";
        }
        return String.valueOf(instanceKey);
    }
}
