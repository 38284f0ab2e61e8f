package com.exohunt.inference;

import com.exohunt.error.ModelUnavailableException;
import com.exohunt.model.Classification;
import com.exohunt.model.FeatureVector;
import com.exohunt.model.PredictionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Builds classifier inputs from a feature vector and KOI parameters, runs the classifier of the
 * given context, and decodes its probabilities.
 */
@Component
public class InferenceAdapter {

    private static final Logger log = LoggerFactory.getLogger(InferenceAdapter.class);

    /**
     * @param koiParams KOI scalars by catalog column name; null is treated as an empty map
     */
    public PredictionResult predict(FeatureVector features, Map<String, Double> koiParams, InferenceContext context) {
        long start = System.nanoTime();
        Map<String, Double> params = koiParams == null ? Map.of() : koiParams;
        if (features.length() != context.sequenceLength()) {
            throw new ModelUnavailableException(String.format(
                    "Model %s expects sequences of %d values, got %d",
                    context.modelVersion(), context.sequenceLength(), features.length()));
        }
        double[] scalars = context.scaler().standardize(params);

        double[] output;
        try {
            output = context.classifier().infer(features.values(), scalars);
        } catch (ModelUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelUnavailableException("Classifier " + context.modelVersion() + " failed: " + e.getMessage(), e);
        }
        Classification[] classes = Classification.values();
        validate(output, classes.length);

        Map<Classification, Double> probabilities = new EnumMap<>(Classification.class);
        int best = 0;
        for (int i = 0; i < classes.length; i++) {
            probabilities.put(classes[i], output[i]);
            if (output[i] > output[best]) best = i;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.debug("Prediction {} (confidence {}) by model {} in {}ms",
                classes[best], output[best], context.modelVersion(), elapsed.toMillis());
        return new PredictionResult(probabilities, classes[best], output[best], elapsed, context.modelVersion());
    }

    private static void validate(double[] output, int expected) {
        if (output == null || output.length != expected) {
            throw new ModelUnavailableException("Classifier returned " + (output == null ? "nothing" : output.length + " values")
                    + ", expected " + expected);
        }
        for (double p : output) {
            if (!Double.isFinite(p) || p < 0.0) {
                throw new ModelUnavailableException("Classifier returned an invalid probability: " + p);
            }
        }
    }
}
