package com.exohunt.preprocess;

import com.exohunt.error.InsufficientDataException;
import com.exohunt.model.FeatureVector;
import com.exohunt.model.LightCurveSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Maps any light curve to the fixed-length sequence the classifier was trained on.
 *
 * <ul>
 *   <li>Longer series are downsampled by averaging within {@value #SEQUENCE_LENGTH} equal-width
 *       time bins spanning {@code [t_min, t_max]}. Bins that fall inside an observing gap get the
 *       neutral baseline and are marked invalid.</li>
 *   <li>Shorter series are copied and right-padded with the neutral baseline; padded positions
 *       are marked invalid.</li>
 * </ul>
 *
 * <p>Padding with 1.0 makes missing data look like a flat, transit-free star to the sequence
 * branch. The trained model expects exactly this, so it is kept as is.
 */
@Component
public class PreprocessingPipeline {

    private static final Logger log = LoggerFactory.getLogger(PreprocessingPipeline.class);

    public static final int SEQUENCE_LENGTH = 2000;
    public static final double NEUTRAL_BASELINE = 1.0;

    public FeatureVector process(LightCurveSeries series) {
        if (series.isEmpty()) throw new InsufficientDataException("Cannot preprocess an empty light curve");

        double[] values = new double[SEQUENCE_LENGTH];
        boolean[] valid = new boolean[SEQUENCE_LENGTH];
        double[] flux = series.flux();

        if (series.size() <= SEQUENCE_LENGTH) {
            Arrays.fill(values, NEUTRAL_BASELINE);
            System.arraycopy(flux, 0, values, 0, flux.length);
            Arrays.fill(valid, 0, flux.length, true);
        } else {
            FluxBin[] bins = bin(series);
            for (int i = 0; i < SEQUENCE_LENGTH; i++) {
                values[i] = bins[i].meanOr(NEUTRAL_BASELINE);
                valid[i] = !bins[i].isEmpty();
            }
        }

        int validCount = 0;
        for (boolean v : valid) if (v) validCount++;
        double qualityScore = (double) validCount / SEQUENCE_LENGTH;

        log.debug("Preprocessed {} points into {} positions ({} valid)", series.size(), SEQUENCE_LENGTH, validCount);
        return new FeatureVector(values, valid, qualityScore, series.durationDays(), series.gapCount(), series.size());
    }

    private static FluxBin[] bin(LightCurveSeries series) {
        FluxBin[] bins = new FluxBin[SEQUENCE_LENGTH];
        for (int i = 0; i < SEQUENCE_LENGTH; i++) bins[i] = new FluxBin();

        double[] time = series.time();
        double[] flux = series.flux();
        double start = time[0];
        double span = series.durationDays();
        for (int i = 0; i < time.length; i++) {
            int index = (int) ((time[i] - start) / span * SEQUENCE_LENGTH);
            bins[Math.min(index, SEQUENCE_LENGTH - 1)].add(flux[i]);
        }
        return bins;
    }
}
