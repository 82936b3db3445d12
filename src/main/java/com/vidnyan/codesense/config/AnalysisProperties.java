package com.vidnyan.codesense.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.yml under {@code codesense.analysis}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "codesense.analysis")
public class AnalysisProperties {

    /**
     * Location pattern of the rule catalog files.
     */
    private String rulesPath = "classpath*:rules/*.json";

    private Smells smells = new Smells();

    private Classifier classifier = new Classifier();

    private Fusion fusion = new Fusion();

    /**
     * Code-smell thresholds. A line is flagged when it strictly exceeds the threshold.
     */
    @Data
    public static class Smells {
        private int longLine = 120;
        private int deepNesting = 4;
        private int complexCondition = 3;
        private int indentWidth = 4;
    }

    /**
     * Synthetic-corpus training parameters.
     */
    @Data
    public static class Classifier {
        private long seed = 42L;
        private int samplesPerClass = 20;
        private int trees = 100;
        private int maxFeatures = 500;
        private int maxNgram = 3;
    }

    /**
     * Score fusion tunables. The defaults are the documented policy.
     */
    @Data
    public static class Fusion {
        private double mlWeight = 0.4;
        private double patternWeight = 0.6;
        private double patternNormalizer = 5.0;
    }
}
