package com.exohunt.service;

import com.exohunt.model.FluxType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Request-independent settings of the analysis facade.
 */
@Component
public class AnalysisDefaults {

    private final FluxType fluxType;
    private final String pipelineVersion;
    private final double periodMin;
    private final double periodMax;
    private final double snrThreshold;

    public AnalysisDefaults(@Value("${exohunt.extractor.flux-type:PDCSAP}") FluxType fluxType,
                            @Value("${exohunt.pipeline.version:v1}") String pipelineVersion,
                            @Value("${exohunt.transit.period-min:0.5}") double periodMin,
                            @Value("${exohunt.transit.period-max:50.0}") double periodMax,
                            @Value("${exohunt.transit.snr-threshold:7.0}") double snrThreshold) {
        this.fluxType = fluxType;
        this.pipelineVersion = pipelineVersion;
        this.periodMin = periodMin;
        this.periodMax = periodMax;
        this.snrThreshold = snrThreshold;
    }

    public FluxType fluxType() {
        return fluxType;
    }

    public String pipelineVersion() {
        return pipelineVersion;
    }

    public double periodMin() {
        return periodMin;
    }

    public double periodMax() {
        return periodMax;
    }

    public double snrThreshold() {
        return snrThreshold;
    }
}
