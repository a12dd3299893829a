package com.phillippitts.sessionscribe.util;

/**
 * Helpers for logging strings that originate outside the process (display names, transcript text).
 */
public final class LogSanitizer {

    private static final int DEFAULT_MAX = 120;

    private LogSanitizer() {}

    /**
     * Replaces control characters (CR/LF included) with spaces and truncates to {@code max}
     * characters, so a hostile display name cannot forge log lines.
     */
    public static String sanitize(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String cut = s.length() <= max ? s : s.substring(0, max) + "...";
        StringBuilder sb = new StringBuilder(cut.length());
        for (int i = 0; i < cut.length(); i++) {
            char c = cut.charAt(i);
            sb.append(Character.isISOControl(c) ? ' ' : c);
        }
        return sb.toString();
    }

    public static String sanitize(String s) {
        return sanitize(s, DEFAULT_MAX);
    }
}
