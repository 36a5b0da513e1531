package com.phillippitts.modelorchestrator.util;

/** Privacy-safe previews of prompts and model output for log lines. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: newlines collapsed to spaces, truncated with a trailing "..." when cut.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : flat.substring(0, max) + ELLIPSIS;
    }
}
