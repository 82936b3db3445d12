package com.vidnyan.codesense.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Severity of a flagged section, with its weight in the pattern score.
 */
public enum Severity {
    ERROR("error", 1.0),        // Likely bug
    SECURITY("security", 0.9),  // Exploitable or leaks secrets
    WARNING("warning", 0.5),    // Should review
    INFO("info", 0.2),          // Informational only
    SUGGESTION("suggestion", 0.1);

    private final String tag;
    private final double weight;

    Severity(String tag, double weight) {
        this.tag = tag;
        this.weight = weight;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public double weight() {
        return weight;
    }

    /**
     * Resolve a severity tag. Unknown tags are a catalog defect and are rejected.
     */
    public static Severity fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("severity tag is required");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.tag.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown severity tag: " + tag));
    }
}
