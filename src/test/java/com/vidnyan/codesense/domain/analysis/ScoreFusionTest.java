package com.vidnyan.codesense.domain.analysis;

import com.vidnyan.codesense.domain.rule.FlaggedSection;
import com.vidnyan.codesense.domain.rule.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoreFusionTest {

    private final ScoreFusion fusion = new ScoreFusion();

    private static FlaggedSection hit(int line, Severity severity) {
        return new FlaggedSection(line, "code", "issue " + line, severity, "R-" + line);
    }

    @Test
    void patternScore_ShouldSumSeverityWeightsOverNormalizer() {
        List<FlaggedSection> flagged = List.of(hit(1, Severity.ERROR), hit(2, Severity.SECURITY));

        assertEquals(0.38, fusion.patternScore(flagged), 1e-9);
    }

    @Test
    void patternScore_ShouldSaturateAtOne() {
        List<FlaggedSection> flagged = new ArrayList<>(Collections.nCopies(10, hit(1, Severity.ERROR)));

        assertEquals(1.0, fusion.patternScore(flagged), 1e-9);
        assertEquals(1.0, fusion.riskScore(flagged, 1.0), 1e-9);
    }

    @Test
    void riskScore_ShouldWeightMlAndPatternScores() {
        List<FlaggedSection> flagged = List.of(hit(3, Severity.ERROR), hit(4, Severity.INFO));

        // 0.4 * 0.5 + 0.6 * (1.2 / 5)
        assertEquals(0.344, fusion.riskScore(flagged, 0.5), 1e-9);
    }

    @Test
    void riskScore_ShouldRoundTheExactBinaryValue() {
        // 0.4 * 0.03125 is slightly above 0.0125 as a double
        assertEquals(0.013, fusion.riskScore(List.of(), 0.03125));
    }

    @Test
    void riskScore_ShouldRejectProbabilityOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> fusion.riskScore(List.of(), 1.2));
        assertThrows(IllegalArgumentException.class, () -> fusion.riskScore(List.of(), -0.1));
        assertThrows(IllegalArgumentException.class, () -> fusion.riskScore(List.of(), Double.NaN));
    }

    @Test
    void fuse_ShouldUseInclusiveLevelThresholds() {
        assertEquals(RiskLevel.LOW, fusion.fuse(List.of(), 0.5).riskLevel());
        assertEquals(RiskLevel.MEDIUM, fusion.fuse(List.of(), 1.0).riskLevel());

        List<FlaggedSection> halfPattern = List.of(hit(1, Severity.ERROR), hit(2, Severity.ERROR), hit(3, Severity.WARNING));
        DefectPrediction high = fusion.fuse(halfPattern, 1.0);
        assertEquals(0.7, high.riskScore(), 1e-9);
        assertEquals(RiskLevel.HIGH, high.riskLevel());
    }

    @Test
    void fuse_ShouldListRuleSummariesBeforeSmells() {
        List<FlaggedSection> flagged = List.of(hit(2, Severity.WARNING), hit(7, Severity.INFO));

        DefectPrediction prediction = fusion.fuse(flagged, 0.0, ScoreFusion.UNTRAINED_CONFIDENCE,
                List.of("Line 9: Line too long (> 120 chars) (130 chars)"));

        assertEquals(List.of("Line 2: issue 2", "Line 7: issue 7", "Line 9: Line too long (> 120 chars) (130 chars)"),
                prediction.issuesDetected());
        assertEquals(0.5, prediction.confidence());
        assertEquals(2, prediction.flaggedSections().size());
    }

    @Test
    void fuse_ShouldReportTrainedConfidenceByDefault() {
        assertEquals(ScoreFusion.TRAINED_CONFIDENCE, fusion.fuse(List.of(), 0.3).confidence());
    }

    @Test
    void weights_ShouldRejectInvalidPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new ScoreFusion.Weights(0.7, 0.6, 5.0));
        assertThrows(IllegalArgumentException.class, () -> new ScoreFusion.Weights(0.4, 0.6, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ScoreFusion.Weights(-0.1, 0.6, 5.0));
    }

    @Test
    void riskLevel_ShouldMapScoresToLevels() {
        assertEquals(RiskLevel.LOW, RiskLevel.of(0.0));
        assertEquals(RiskLevel.LOW, RiskLevel.of(0.399));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.of(0.4));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.of(0.699));
        assertEquals(RiskLevel.HIGH, RiskLevel.of(0.7));
        assertEquals(RiskLevel.HIGH, RiskLevel.of(1.0));
    }
}
