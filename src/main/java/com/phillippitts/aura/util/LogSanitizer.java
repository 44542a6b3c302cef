package com.phillippitts.aura.util;

/** Utility for privacy-safe logging of patient-supplied text. */
public final class LogSanitizer {

    /** Default preview length for symptom and report text. */
    public static final int DEFAULT_PREVIEW_CHARS = 80;

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
     * Single-line preview of free text: line breaks become spaces so one entry stays one log line,
     * and text longer than {@link #DEFAULT_PREVIEW_CHARS} is cut and marked with "...".
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n]+", " ").trim();
        return flat.length() <= DEFAULT_PREVIEW_CHARS ? flat : truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
