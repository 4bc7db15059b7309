package com.purchasingpower.copilot.util;

/**
 * Text shortening helpers shared by logging and display rendering.
 */
public final class TextPreview {

    private TextPreview() {
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String preview(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * First {@code maxLength} characters of the text, without any marker.
     * Display templates append their own ellipsis.
     */
    public static String head(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
