package com.vidnyan.codesense.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Languages with a dedicated structural extractor.
 * Any other tag is analyzed in heuristic, metrics-only mode.
 */
public enum SourceLanguage {
    PYTHON("python"),
    JAVASCRIPT("javascript"),
    TYPESCRIPT("typescript"),
    JAVA("java");

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("pyw", "python"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("java", "java"),
            Map.entry("go", "go"),
            Map.entry("cpp", "cpp"),
            Map.entry("cc", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("h", "cpp")
    );

    private final String tag;
    SourceLanguage(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolve a language tag, case-insensitively.
     */
    public static Optional<SourceLanguage> fromTag(String tag) {
        String normalized = normalize(tag);
        return Arrays.stream(values())
                .filter(l -> l.tag.equals(normalized))
                .findFirst();
    }

    /**
     * Lower-cased, trimmed tag. Rejects null or blank tags.
     */
    public static String normalize(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("language tag is required");
        }
        return tag.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Guess a language tag from a file name. Unknown extensions are returned as-is.
     */
    public static String inferTag(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "text";
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return EXTENSIONS.getOrDefault(extension, extension);
    }
}
