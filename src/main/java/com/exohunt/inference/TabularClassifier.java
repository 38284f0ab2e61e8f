package com.exohunt.inference;

/**
 * The frozen two-branch classifier: a flux sequence plus standardized tabular scalars in,
 * one probability per {@link com.exohunt.model.Classification} out.
 */
public interface TabularClassifier {

    /**
     * @param sequence  fixed-length flux sequence
     * @param scalars   standardized KOI parameters in {@link KoiFeature} order
     * @return probabilities for FALSE_POSITIVE, CANDIDATE and CONFIRMED, in that order
     */
    double[] infer(double[] sequence, double[] scalars);
}
