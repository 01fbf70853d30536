package com.ambient.core.tenant;

import java.util.Locale;

/**
 * Turns free-form subject and key names into strings usable inside object names.
 */
public final class NameSanitizer {

    static final int MAX_LENGTH = 63;
    static final String FALLBACK = "group";

    private NameSanitizer() {}

    /**
     * Lowercases, collapses every run of characters outside {@code [a-z0-9]} into one {@code -},
     * caps the length and trims dashes. Returns {@value #FALLBACK} when nothing usable remains.
     */
    public static String sanitize(String input) {
        String lower = input == null ? "" : input.toLowerCase(Locale.ROOT);
        var out = new StringBuilder();
        boolean previousDash = false;
        for (int i = 0; i < lower.length() && out.length() < MAX_LENGTH; i++) {
            char c = lower.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                out.append(c);
                previousDash = false;
            } else if (!previousDash) {
                out.append('-');
                previousDash = true;
            }
        }
        String trimmed = out.toString().replaceAll("^-+|-+$", "");
        return trimmed.isEmpty() ? FALLBACK : trimmed;
    }
}
