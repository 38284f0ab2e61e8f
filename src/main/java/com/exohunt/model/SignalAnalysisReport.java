package com.exohunt.model;

import java.util.List;

/**
 * Combined transit search, periodogram and anomaly detection over one light curve.
 * A failure in one analysis is reported in its own slot and never hides the others.
 */
public record SignalAnalysisReport(String sourceId,
                                   SubResult<TransitSearchResult> transits,
                                   SubResult<PeriodogramResult> periodogram,
                                   SubResult<List<AnomalyPoint>> anomalies) {

    public boolean isComplete() {
        return transits.isOk() && periodogram.isOk() && anomalies.isOk();
    }
}
