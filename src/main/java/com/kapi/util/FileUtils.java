package com.kapi.util;

import okhttp3.MediaType;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * File helpers for naming, sizing and typing upload sources and output files.
 */
public final class FileUtils {

    private FileUtils() {}

    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

    private static final Map<String, MediaType> MEDIA_TYPES = Map.ofEntries(
            Map.entry("png", MediaType.get("image/png")),
            Map.entry("jpg", MediaType.get("image/jpeg")),
            Map.entry("jpeg", MediaType.get("image/jpeg")),
            Map.entry("gif", MediaType.get("image/gif")),
            Map.entry("bmp", MediaType.get("image/bmp")),
            Map.entry("webp", MediaType.get("image/webp")),
            Map.entry("mp4", MediaType.get("video/mp4")),
            Map.entry("mov", MediaType.get("video/quicktime")),
            Map.entry("avi", MediaType.get("video/x-msvideo")),
            Map.entry("webm", MediaType.get("video/webm"))
    );

    /**
     * Lower-cased extension without the dot, or an empty string when the name has none.
     */
    public static String extension(Path file) {
        Path name = file.getFileName();
        if (name == null) return "";

        String s = name.toString();
        int dot = s.lastIndexOf('.');
        if (dot < 0 || dot == s.length() - 1) return "";
        return s.substring(dot + 1).toLowerCase();
    }

    /**
     * Content type sent with a multipart file part.
     */
    public static MediaType mediaTypeOf(Path file) {
        return MEDIA_TYPES.getOrDefault(extension(file), OCTET_STREAM);
    }

    /**
     * Format byte count for display (e.g. "2.4 MB").
     */
    public static String formatSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
    }
}
