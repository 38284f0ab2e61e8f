package com.exohunt.model;

import com.exohunt.error.DataFormatException;
import com.exohunt.error.InsufficientDataException;

/**
 * A validated, normalized light curve.
 *
 * <p>Times are in days and strictly ascending; flux is normalized near 1.0. Every time and flux
 * value is finite. Arrays are copied on construction and must be treated as read-only by callers
 * of the accessors.
 *
 * @param time      Observation times in days, strictly ascending
 * @param flux      Normalized flux, same length as {@code time}
 * @param quality   Optional quality bitmask per point (null when the source has none)
 * @param mission   Mission name (e.g., "Kepler"), "UNKNOWN" when not recorded
 * @param fluxType  Flux product the values were taken from
 * @param gapCount  Number of cadence gaps detected during extraction
 * @param targetId  Catalog identifier from the source metadata, null when absent
 */
public record LightCurveSeries(double[] time,
                               double[] flux,
                               int[] quality,
                               String mission,
                               FluxType fluxType,
                               int gapCount,
                               String targetId) {

    public static final String UNKNOWN_MISSION = "UNKNOWN";

    public LightCurveSeries {
        if (time == null || flux == null) throw new DataFormatException("Time and flux arrays are required");
        if (time.length != flux.length) {
            throw new DataFormatException("Time and flux lengths differ: " + time.length + " vs " + flux.length);
        }
        if (quality != null && quality.length != time.length) {
            throw new DataFormatException("Quality length " + quality.length + " does not match time length " + time.length);
        }
        int finiteFlux = 0;
        for (double f : flux) if (Double.isFinite(f)) finiteFlux++;
        if (flux.length > 0 && finiteFlux == 0) {
            throw new InsufficientDataException("No finite flux values among " + flux.length + " points");
        }
        for (int i = 0; i < time.length; i++) {
            if (!Double.isFinite(time[i]) || !Double.isFinite(flux[i])) {
                throw new DataFormatException("Non-finite time or flux at index " + i);
            }
        }
        for (int i = 1; i < time.length; i++) {
            if (!(time[i] > time[i - 1])) {
                throw new DataFormatException("Times must be strictly ascending; violated at index " + i);
            }
        }
        if (fluxType == null) throw new DataFormatException("Flux type is required");
        if (gapCount < 0) throw new DataFormatException("Gap count must be non-negative");
        time = time.clone();
        flux = flux.clone();
        quality = quality == null ? null : quality.clone();
        mission = mission == null || mission.isBlank() ? UNKNOWN_MISSION : mission;
    }

    /**
     * Convenience factory for an already-normalized PDCSAP series without metadata.
     */
    public static LightCurveSeries of(double[] time, double[] flux) {
        return new LightCurveSeries(time, flux, null, UNKNOWN_MISSION, FluxType.PDCSAP, 0, null);
    }

    public int size() {
        return time.length;
    }

    public boolean isEmpty() {
        return time.length == 0;
    }

    /**
     * Time span covered by the series in days; 0 for fewer than two points.
     */
    public double durationDays() {
        return time.length < 2 ? 0.0 : time[time.length - 1] - time[0];
    }

    /**
     * Returns a series holding only the points whose index is set in {@code keep}.
     */
    public LightCurveSeries select(boolean[] keep) {
        int count = 0;
        for (boolean k : keep) if (k) count++;
        double[] t = new double[count];
        double[] f = new double[count];
        int[] q = quality == null ? null : new int[count];
        int j = 0;
        for (int i = 0; i < time.length; i++) {
            if (!keep[i]) continue;
            t[j] = time[i];
            f[j] = flux[i];
            if (q != null) q[j] = quality[i];
            j++;
        }
        return new LightCurveSeries(t, f, q, mission, fluxType, gapCount, targetId);
    }
}
