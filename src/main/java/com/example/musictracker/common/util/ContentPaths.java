package com.example.musictracker.common.util;

import com.example.musictracker.common.exception.BusinessException;
import java.util.Locale;

/**
 * Helpers for collection-relative content paths.
 *
 * <p>Segments are separated by {@code /}, directory paths end with {@code /} and the collection root is
 * the empty path.
 */
public final class ContentPaths {

    public static final String ROOT = "";

    private ContentPaths() {
    }

    /**
     * Normalizes a user supplied directory path or prefix.
     */
    public static String normalizeDirectory(String value) {
        if (value == null) {
            return ROOT;
        }
        String normalized = value.trim().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        normalized = normalized.replaceAll("/{2,}", "/");
        if (normalized.isEmpty()) {
            return ROOT;
        }
        for (String segment : normalized.split("/")) {
            if (".".equals(segment) || "..".equals(segment)) {
                throw new BusinessException("400", "Relative segments are not allowed in path: " + value);
            }
        }
        return normalized.endsWith("/") ? normalized : normalized + "/";
    }

    /**
     * Normalizes a user supplied file path; directory paths are rejected.
     */
    public static String normalizeFile(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.endsWith("/") || trimmed.endsWith("\\")) {
            throw new BusinessException("400", "Not a file path: " + value);
        }
        String normalized = normalizeDirectory(trimmed);
        if (normalized.isEmpty()) {
            throw new BusinessException("400", "File path is missing");
        }
        return normalized.substring(0, normalized.length() - 1);
    }

    public static boolean isDirectory(String contentPath) {
        return contentPath.isEmpty() || contentPath.endsWith("/");
    }

    /**
     * Parent directory of a file or directory path, {@link #ROOT} for top-level entries.
     */
    public static String parentDirectory(String contentPath) {
        String path = contentPath.endsWith("/") ? contentPath.substring(0, contentPath.length() - 1) : contentPath;
        int idx = path.lastIndexOf('/');
        return idx < 0 ? ROOT : path.substring(0, idx + 1);
    }

    public static String childFile(String directoryPath, String name) {
        return directoryPath + name;
    }

    public static String childDirectory(String directoryPath, String name) {
        return directoryPath + name + "/";
    }

    /**
     * Lower-case extension of a file name without the dot, empty if there is none.
     */
    public static String extension(String fileName) {
        int idx = fileName.lastIndexOf('.');
        if (idx < 0 || idx == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(idx + 1).toLowerCase(Locale.ROOT);
    }

    public static String fileName(String contentPath) {
        String path = contentPath.endsWith("/") ? contentPath.substring(0, contentPath.length() - 1) : contentPath;
        int idx = path.lastIndexOf('/');
        return idx < 0 ? path : path.substring(idx + 1);
    }

    /**
     * Number of directory levels between the prefix and a directory path below it, 0 for the prefix itself.
     */
    public static int depthBelow(String prefix, String directoryPath) {
        if (!directoryPath.startsWith(prefix)) {
            throw new IllegalArgumentException("Path '" + directoryPath + "' is not below '" + prefix + "'");
        }
        String remainder = directoryPath.substring(prefix.length());
        int depth = 0;
        for (int i = 0; i < remainder.length(); i++) {
            if (remainder.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    public static String replacePrefix(String contentPath, String oldPrefix, String newPrefix) {
        if (!contentPath.startsWith(oldPrefix)) {
            throw new IllegalArgumentException("Path '" + contentPath + "' is not below '" + oldPrefix + "'");
        }
        return newPrefix + contentPath.substring(oldPrefix.length());
    }
}
