package com.exohunt.error;

/**
 * Raised when a required tabular feature is absent and has no defined default.
 * Tabular inputs are never silently substituted.
 */
public class MissingFeatureException extends AnalysisException {

    private final String featureName;

    public MissingFeatureException(String featureName) {
        super(ErrorKind.MISSING_FEATURE, "Required feature '" + featureName + "' is missing and has no default");
        this.featureName = featureName;
    }

    public String getFeatureName() {
        return featureName;
    }
}
