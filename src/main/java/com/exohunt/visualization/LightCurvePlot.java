package com.exohunt.visualization;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Render-ready light curve.
 *
 * <pre>
 * {
 *   "source": "kic:757450",
 *   "time": [131.51, ...],
 *   "flux": [1.000213, ...],
 *   "anomalies": { "time": [...], "flux": [...] },
 *   "transits": [ { "start": 133.2, "end": 133.3, "candidate": 0 } ],
 *   "points": 4000
 * }
 * </pre>
 *
 * {@code time}/{@code flux} may be decimated; {@code points} is the size before decimation.
 */
public record LightCurvePlot(@JsonProperty("source") String sourceId,
                             @JsonProperty("time") List<Double> time,
                             @JsonProperty("flux") List<Double> flux,
                             @JsonProperty("anomalies") Overlay anomalies,
                             @JsonProperty("transits") List<TransitWindow> transitWindows,
                             @JsonProperty("points") int sourcePoints) {

    /**
     * Points drawn on top of the curve.
     */
    public record Overlay(@JsonProperty("time") List<Double> time, @JsonProperty("flux") List<Double> flux) {

        static final Overlay EMPTY = new Overlay(List.of(), List.of());
    }
}
