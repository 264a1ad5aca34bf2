package com.rpcstub.generator.codegen.util;

import java.util.Locale;

/**
 * Utility for consistent Go naming conventions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts snake_case or camelCase to PascalCase, keeping the case of inner letters.
     * Example: "base_resp" -> "BaseResp", "baseResp" -> "BaseResp".
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (String part : name.split("_")) {
            sb.append(capitalize(part));
        }
        return sb.toString();
    }

    /**
     * Converts a name to camelCase. Example: "BaseResp" -> "baseResp", "Base" -> "base".
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Go package name for a namespace: last segment, lower case, hyphens to underscores.
     * Example: "example.user_service" -> "user_service".
     */
    public static String toPackageName(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            return "";
        }
        String last = namespace;
        int cut = Math.max(namespace.lastIndexOf('.'), namespace.lastIndexOf('/'));
        if (cut >= 0) {
            last = namespace.substring(cut + 1);
        }
        return last.toLowerCase(Locale.ROOT).replace('-', '_');
    }

    /**
     * Last slash-separated segment of an import path.
     */
    public static String lastPathSegment(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
