package com.exohunt.inference;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tabular KOI parameters consumed by the classifier's scalar branch, in model input order.
 */
public enum KoiFeature {

    PERIOD("koi_period"),
    DURATION("koi_duration"),
    DEPTH("koi_depth"),
    PLANET_RADIUS("koi_prad"),
    RADIUS_RATIO("koi_ror"),
    MODEL_SNR("koi_model_snr"),
    NUM_TRANSITS("koi_num_transits"),
    STELLAR_TEFF("koi_steff"),
    STELLAR_LOGG("koi_slogg"),
    STELLAR_RADIUS("koi_srad"),
    STELLAR_MASS("koi_smass"),
    KEPLER_MAG("koi_kepmag"),
    INSOLATION("koi_insol"),
    DISTANCE_RATIO("koi_dor"),
    PLANET_COUNT("koi_count");

    private final String label;

    private static final Map<String, KoiFeature> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(KoiFeature::getLabel, Function.identity()));

    KoiFeature(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Look up a feature by its catalog column name (e.g., "koi_period").
     */
    public static Optional<KoiFeature> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }
}
