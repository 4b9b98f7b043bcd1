package com.phillippitts.docassist.util;

/** Utility for privacy-safe logging of source locators and text previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Strips query string and fragment from a URL-like locator so tokens in query
     * parameters never reach the logs, then truncates.
     */
    public static String source(String locator, int max) {
        if (locator == null) {
            return "";
        }
        int cut = locator.length();
        int q = locator.indexOf('?');
        int h = locator.indexOf('#');
        if (q >= 0) {
            cut = q;
        }
        if (h >= 0 && h < cut) {
            cut = h;
        }
        return truncate(locator.substring(0, cut), max);
    }
}
