package com.deskclaw.common.text;

/**
 * Length limiting for names and values shown to agents.
 */
public final class TextTruncation {

    public static final String ELLIPSIS = "...";

    private TextTruncation() {
    }

    /**
     * Cut {@code text} to at most {@code maxLength} characters, the last three being
     * {@value #ELLIPSIS}. Null stays null; text that already fits is returned as is.
     * Limits shorter than the ellipsis cut without a marker. A cut never splits a
     * surrogate pair.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        if (maxLength < ELLIPSIS.length()) {
            return text.substring(0, safeCut(text, Math.max(0, maxLength)));
        }
        return text.substring(0, safeCut(text, maxLength - ELLIPSIS.length())) + ELLIPSIS;
    }

    private static int safeCut(String text, int end) {
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            return end - 1;
        }
        return end;
    }

    /**
     * True when {@code text} is null, empty or whitespace only.
     */
    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
