package com.exohunt.inference;

import com.exohunt.error.MissingFeatureException;
import com.exohunt.error.ModelUnavailableException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-feature standardization table shipped with the model.
 */
public record ScalerTable(Map<KoiFeature, FeatureScaling> scalings) {

    public ScalerTable {
        for (KoiFeature feature : KoiFeature.values()) {
            if (!scalings.containsKey(feature)) {
                throw new ModelUnavailableException("Scaler table has no entry for " + feature.getLabel());
            }
        }
        scalings = Collections.unmodifiableMap(new EnumMap<>(scalings));
    }

    public int featureCount() {
        return scalings.size();
    }

    /**
     * Standardizes the named parameters in {@link KoiFeature} order. Absent or non-finite values
     * take the feature's default; names that are not KOI features are ignored.
     *
     * @throws MissingFeatureException if a value is absent and the feature has no default
     */
    public double[] standardize(Map<String, Double> params) {
        KoiFeature[] features = KoiFeature.values();
        double[] scaled = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            KoiFeature feature = features[i];
            FeatureScaling scaling = scalings.get(feature);
            Double raw = params == null ? null : params.get(feature.getLabel());
            if (raw == null || !Double.isFinite(raw)) {
                if (scaling.defaultValue() == null) throw new MissingFeatureException(feature.getLabel());
                raw = scaling.defaultValue();
            }
            scaled[i] = scaling.standardize(raw);
        }
        return scaled;
    }
}
