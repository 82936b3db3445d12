package com.vidnyan.codesense.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * Line-oriented helpers over raw source text.
 */
public final class SourceText {

    private SourceText() {
    }

    /**
     * Physical lines split on '\n'. Empty text has no lines; a trailing newline yields a final empty line.
     */
    public static List<String> lines(String code) {
        if (code.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(code.split("\n", -1));
    }

    /**
     * 1-indexed line containing the character at {@code offset}.
     */
    public static int lineAt(String code, int offset) {
        int line = 1;
        int limit = Math.min(offset, code.length());
        for (int i = 0; i < limit; i++) {
            if (code.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Lines {@code startLine..endLine} (1-indexed, inclusive) joined with '\n'. Out-of-range parts are dropped.
     */
    public static String slice(List<String> lines, int startLine, int endLine) {
        int from = Math.max(0, startLine - 1);
        int to = Math.min(lines.size(), endLine);
        if (from >= to) {
            return "";
        }
        return String.join("\n", lines.subList(from, to));
    }

    /**
     * Number of leading whitespace characters.
     */
    public static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Non-overlapping occurrences of {@code needle} in {@code text}.
     */
    public static int countOccurrences(String text, String needle) {
        if (needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = text.indexOf(needle);
        while (from >= 0) {
            count++;
            from = text.indexOf(needle, from + needle.length());
        }
        return count;
    }
}
