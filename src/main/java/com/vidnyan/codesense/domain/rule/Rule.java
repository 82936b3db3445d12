package com.vidnyan.codesense.domain.rule;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Anti-pattern rule: a case-insensitive, line-local regular expression with a severity.
 * Immutable; built once when the catalog loads.
 */
public record Rule(
    String id,
    String language,
    Pattern pattern,
    String message,
    Severity severity
) {

    /**
     * Compile a rule from its catalog entry, rejecting malformed patterns and unknown severities.
     */
    public static Rule compile(String id, String language, String regex, String message, String severityTag) {
        if (id == null || id.isBlank()) {
            throw new RuleCatalogException("rule without id in catalog for language " + language);
        }
        if (message == null || message.isBlank()) {
            throw new RuleCatalogException("rule " + id + " has no message");
        }
        if (regex == null || regex.isEmpty()) {
            throw new RuleCatalogException("rule " + id + " has no pattern");
        }
        Severity severity;
        try {
            severity = Severity.fromTag(severityTag);
        } catch (IllegalArgumentException e) {
            throw new RuleCatalogException("rule " + id + ": " + e.getMessage(), e);
        }
        try {
            Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNIX_LINES);
            return new Rule(id, language, pattern, message, severity);
        } catch (PatternSyntaxException e) {
            throw new RuleCatalogException("rule " + id + " has a malformed pattern: " + e.getDescription(), e);
        }
    }

    /**
     * True if the pattern occurs anywhere in the line.
     */
    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }
}
