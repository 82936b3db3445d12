package com.vidnyan.codesense.domain.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One rule match on one source line.
 */
@JsonPropertyOrder({"line", "code", "issue", "severity", "rule_id"})
public record FlaggedSection(
    int line,
    String code,
    String issue,
    Severity severity,
    @JsonProperty("rule_id") String ruleId
) {

    /**
     * Build a flagged section from a rule hit.
     */
    public static FlaggedSection of(Rule rule, int line, String sourceLine) {
        return new FlaggedSection(line, sourceLine.strip(), rule.message(), rule.severity(), rule.id());
    }

    /**
     * Human-readable issue summary, e.g. "Line 3: Bare except clause catches all exceptions".
     */
    public String summary() {
        return "Line " + line + ": " + issue;
    }
}
