package com.team.buildrelay.util;

import org.springframework.stereotype.Component;

/**
 * Helpers for shortening free text (job commands, commit SHAs) so chat
 * messages stay on one readable line.
 */
@Component
public class TextTruncator {

    static final String ELLIPSIS = "...";

    /**
     * First line of a possibly multi-line text, trimmed.
     *
     * @return the trimmed first line, or an empty string for null/empty input
     */
    public String firstLine(String text) {
        if (text == null) return "";
        return text.lines().findFirst().orElse("").trim();
    }

    /**
     * Cap text at {@code maxLength} characters. Longer text keeps its first
     * {@code maxLength - 3} characters followed by "...", so the result is never
     * longer than {@code maxLength}. Counts code points, not UTF-16 units.
     */
    public String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        int keep = Math.max(0, maxLength - ELLIPSIS.length());
        return text.substring(0, text.offsetByCodePoints(0, keep)) + ELLIPSIS;
    }

    /**
     * Leading {@code length} characters, or the whole text when it is shorter.
     */
    public String prefix(String text, int length) {
        if (text == null) return "";
        if (text.codePointCount(0, text.length()) <= length) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, length));
    }
}
