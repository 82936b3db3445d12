package com.vidnyan.codesense.domain.analysis;

import com.vidnyan.codesense.domain.rule.FlaggedSection;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Combines rule hits and the classifier probability into one bounded risk score.
 *
 * <pre>
 * pattern = min(1, sum(severity weight) / normalizer)
 * risk    = clamp(mlWeight * ml + patternWeight * pattern, 0, 1), rounded to 3 decimals
 * </pre>
 *
 * The weights are a fixed policy, not learned. They can be tuned through {@link Weights}, but the
 * defaults must stay at 0.4 / 0.6 / 5 so scores are reproducible. Stateless and thread-safe.
 */
public final class ScoreFusion {

    /** Confidence reported when the classifier is trained. */
    public static final double TRAINED_CONFIDENCE = 0.8;

    /** Confidence reported when the classifier fell back to the neutral score. */
    public static final double UNTRAINED_CONFIDENCE = 0.5;

    private final Weights weights;

    public ScoreFusion() {
        this(Weights.defaults());
    }

    public ScoreFusion(Weights weights) {
        this.weights = weights;
    }

    /**
     * Fusion weights.
     */
    public record Weights(double mlWeight, double patternWeight, double patternNormalizer) {

        public Weights {
            if (mlWeight < 0 || patternWeight < 0 || mlWeight + patternWeight > 1.0 + 1e-9) {
                throw new IllegalArgumentException("weights must be non-negative and sum to at most 1");
            }
            if (patternNormalizer <= 0) {
                throw new IllegalArgumentException("pattern normalizer must be positive");
            }
        }

        public static Weights defaults() {
            return new Weights(0.4, 0.6, 5.0);
        }
    }

    /**
     * Severity-weighted rule score in [0, 1].
     */
    public double patternScore(List<FlaggedSection> flagged) {
        double sum = 0.0;
        for (FlaggedSection section : flagged) {
            sum += section.severity().weight();
        }
        return Math.min(1.0, sum / weights.patternNormalizer());
    }

    /**
     * Fused risk score, clamped to [0, 1] and rounded to three decimals.
     */
    public double riskScore(List<FlaggedSection> flagged, double mlProbability) {
        if (Double.isNaN(mlProbability) || mlProbability < 0.0 || mlProbability > 1.0) {
            throw new IllegalArgumentException("classifier probability out of range: " + mlProbability);
        }
        double raw = weights.mlWeight() * mlProbability + weights.patternWeight() * patternScore(flagged);
        return round3(Math.min(1.0, Math.max(0.0, raw)));
    }

    /**
     * Fuse with the trained-model confidence and the rule hits as the only issues.
     */
    public DefectPrediction fuse(List<FlaggedSection> flagged, double mlProbability) {
        return fuse(flagged, mlProbability, TRAINED_CONFIDENCE, List.of());
    }

    /**
     * Fuse rule hits and classifier output. Issues are the rule-hit summaries followed by the smell issues.
     */
    public DefectPrediction fuse(List<FlaggedSection> flagged, double mlProbability,
                                 double confidence, List<String> smellIssues) {
        double riskScore = riskScore(flagged, mlProbability);
        List<String> issues = new ArrayList<>(flagged.size() + smellIssues.size());
        flagged.forEach(section -> issues.add(section.summary()));
        issues.addAll(smellIssues);
        // level is taken from the rounded score so the two never disagree
        return new DefectPrediction(riskScore, RiskLevel.of(riskScore), flagged, confidence, issues);
    }

    private static double round3(double value) {
        return new BigDecimal(value).setScale(3, RoundingMode.HALF_EVEN).doubleValue();
    }
}
