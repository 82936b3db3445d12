package com.vidnyan.codesense.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vidnyan.codesense.domain.rule.FlaggedSection;

import java.util.List;

/**
 * Fused defect-risk verdict for one snippet.
 * Immutable value object.
 */
@JsonPropertyOrder({"risk_score", "risk_level", "flagged_sections", "confidence", "issues_detected"})
public record DefectPrediction(
    @JsonProperty("risk_score") double riskScore,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("flagged_sections") List<FlaggedSection> flaggedSections,
    double confidence,
    @JsonProperty("issues_detected") List<String> issuesDetected
) {

    public DefectPrediction {
        if (riskScore < 0.0 || riskScore > 1.0) {
            throw new IllegalArgumentException("risk score out of range: " + riskScore);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        flaggedSections = List.copyOf(flaggedSections);
        issuesDetected = List.copyOf(issuesDetected);
    }
}
