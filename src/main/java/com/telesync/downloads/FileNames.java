package com.telesync.downloads;

import java.util.Locale;
import java.util.regex.Pattern;

public final class FileNames {

    private static final Pattern INVALID = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_LENGTH = 100;
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FileNames() {}

    /** Makes a string safe to use as a single path segment. */
    public static String sanitize(String name) {
        if (name == null || name.isBlank()) return "_";
        var cleaned = WHITESPACE.matcher(INVALID.matcher(name.strip()).replaceAll("_")).replaceAll("_");
        if (cleaned.chars().allMatch(c -> c == '.')) cleaned = cleaned.replace('.', '_');
        return cleaned.length() > MAX_LENGTH ? cleaned.substring(0, MAX_LENGTH) : cleaned;
    }

    /** {@code clip.mp4} with n=2 becomes {@code clip-2.mp4}. */
    public static String withSuffix(String name, int n) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0) return name + "-" + n;
        return name.substring(0, dot) + "-" + n + name.substring(dot);
    }

    public static String formatSize(long bytes) {
        if (bytes <= 0) return "0 B";
        double size = bytes;
        int i = 0;
        while (size >= 1024 && i < UNITS.length - 1) {
            size /= 1024.0;
            i++;
        }
        return String.format(Locale.ROOT, "%.1f %s", size, UNITS[i]);
    }

    /** Picks a filename for an item that did not carry one. */
    public static String fallbackName(String sourceItemRef, String contentType) {
        var ext = ".bin";
        if (contentType != null) {
            var ct = contentType.toLowerCase(Locale.ROOT);
            if (ct.startsWith("video/mp4")) ext = ".mp4";
            else if (ct.startsWith("video/webm")) ext = ".webm";
            else if (ct.startsWith("video/quicktime")) ext = ".mov";
            else if (ct.startsWith("video/x-matroska")) ext = ".mkv";
            else if (ct.startsWith("video/")) ext = ".mp4";
        }
        return sanitize(sourceItemRef) + ext;
    }
}
