package com.ai.screening.utils;

public final class TextSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 5000;

    private TextSanitizer() {
    }

    public static String sanitize(String text) {
        return sanitize(text, DEFAULT_MAX_LENGTH);
    }

    /**
     * Drops control characters except newline and tab, then truncates to maxLength chars.
     */
    public static String sanitize(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(Math.min(text.length(), maxLength));
        for (int i = 0; i < text.length() && sb.length() < maxLength; i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\t' || !Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
