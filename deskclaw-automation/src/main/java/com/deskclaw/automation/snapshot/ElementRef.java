package com.deskclaw.automation.snapshot;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalises the ways an agent may quote a reference token back to us.
 * Accepts {@code w1e5}, {@code @w1e5}, {@code ref=w1e5} and {@code [ref=w1e5]}.
 */
public final class ElementRef {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("^\\S+e\\d+$");
    private static final Pattern BRACKET_PATTERN =
            Pattern.compile("^\\[\\s*ref\\s*=\\s*([^\\]\\s]+)\\s*]$", Pattern.CASE_INSENSITIVE);

    private ElementRef() {
    }

    /**
     * Strip decoration from a raw reference. Returns null when nothing token-like
     * remains.
     */
    public static String parse(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        Matcher bracket = BRACKET_PATTERN.matcher(trimmed);
        if (bracket.matches()) {
            trimmed = bracket.group(1);
        } else if (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        } else if (trimmed.regionMatches(true, 0, "ref=", 0, 4)) {
            trimmed = trimmed.substring(4);
        }
        trimmed = trimmed.trim();
        return isValid(trimmed) ? trimmed : null;
    }

    public static boolean isValid(String token) {
        return token != null && TOKEN_PATTERN.matcher(token).matches();
    }
}
