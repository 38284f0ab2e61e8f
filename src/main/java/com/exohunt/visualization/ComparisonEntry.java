package com.exohunt.visualization;

import com.exohunt.model.AnalysisError;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One curve of a multi-source comparison: its plot, or the reason it could not be built.
 */
public record ComparisonEntry(@JsonProperty("label") String label,
                              @JsonProperty("plot") LightCurvePlot plot,
                              @JsonProperty("error") AnalysisError error) {

    public boolean isOk() {
        return error == null;
    }
}
