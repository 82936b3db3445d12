package com.vidnyan.codesense.adapter.out.ml;

/**
 * Labelled training snippet; label 1 is defective, 0 is clean.
 */
public record TrainingSample(String code, int label) {

    public static final int CLEAN = 0;
    public static final int DEFECTIVE = 1;

    public TrainingSample {
        if (label != CLEAN && label != DEFECTIVE) {
            throw new IllegalArgumentException("label must be 0 or 1: " + label);
        }
    }
}
