package com.exohunt.model;

import com.exohunt.error.InvalidParameterException;

/**
 * A light curve to be fetched from the external archive by Kepler Input Catalog id.
 */
public record ArchiveLightCurve(long kepid) implements LightCurveSource {

    public ArchiveLightCurve {
        if (kepid <= 0) throw new InvalidParameterException("Kepler id must be positive");
    }

    @Override
    public String identity() {
        return "kic:" + kepid;
    }
}
