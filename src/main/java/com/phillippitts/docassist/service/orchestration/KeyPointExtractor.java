package com.phillippitts.docassist.service.orchestration;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pulls key points out of free-form model output.
 *
 * <p>Lines starting with {@code -}, {@code •}, {@code *} or {@code N.} are bullets; their marker
 * is stripped and bullets of 10 characters or fewer are dropped, keeping at most
 * {@value #MAX_BULLETS}. If no bullets survive, up to {@value #MAX_PLAIN_LINES} plain lines
 * longer than 15 characters are used instead.
 */
final class KeyPointExtractor {

    static final int MAX_BULLETS = 5;
    static final int MAX_PLAIN_LINES = 3;
    static final String NO_SUMMARY = "could not generate summary";

    private static final Pattern BULLET = Pattern.compile("^([-•*]|\\d+\\.)");
    private static final Pattern MARKER = Pattern.compile("^([-•*]\\s*|\\d+\\.\\s*)");

    private KeyPointExtractor() {
    }

    static List<String> extract(String text) {
        List<String> lines = new ArrayList<>();
        if (text != null) {
            for (String line : text.split("\n")) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty()) {
                    lines.add(trimmed);
                }
            }
        }

        List<String> bullets = new ArrayList<>();
        for (String line : lines) {
            if (bullets.size() == MAX_BULLETS) {
                break;
            }
            if (BULLET.matcher(line).find()) {
                String point = MARKER.matcher(line).replaceFirst("").trim();
                if (point.length() > 10) {
                    bullets.add(point);
                }
            }
        }
        if (!bullets.isEmpty()) {
            return List.copyOf(bullets);
        }

        List<String> plain = new ArrayList<>();
        for (String line : lines) {
            if (plain.size() == MAX_PLAIN_LINES) {
                break;
            }
            if (line.length() > 15) {
                plain.add(line);
            }
        }
        return List.copyOf(plain);
    }

    /** Like {@link #extract} but never empty. */
    static List<String> extractOrPlaceholder(String text) {
        List<String> points = extract(text);
        return points.isEmpty() ? List.of(NO_SUMMARY) : points;
    }
}
