package com.vidnyan.codesense.application.port.out;

import com.vidnyan.codesense.domain.analysis.ScoreFusion;

/**
 * Port for the statistical defect classifier.
 * Implementations train once and are read-only, and safe for concurrent use, afterwards.
 */
public interface DefectClassifier {

    /**
     * Train the model. Runs at most once; later calls return immediately.
     */
    void initialize();

    /**
     * True once {@link #initialize()} has completed, successfully or not.
     */
    boolean isReady();

    /**
     * True if training succeeded.
     */
    boolean isTrained();

    /**
     * Probability in [0, 1] that the code is defective. Returns 0.5 when untrained. Never throws for
     * malformed code.
     */
    double classify(String code);

    /**
     * Confidence attached to {@link #classify(String)} results.
     */
    default double confidence() {
        return isTrained() ? ScoreFusion.TRAINED_CONFIDENCE : ScoreFusion.UNTRAINED_CONFIDENCE;
    }
}
