package com.exohunt.transit;

/**
 * Best box found for one trial period on the phase-binned curve.
 *
 * @param power     Normalized detection statistic, 0 when no dip was found
 * @param startBin  First phase bin of the box
 * @param width     Box width in bins
 */
record BoxFit(double power, int startBin, int width) {

    static final BoxFit NONE = new BoxFit(0.0, 0, 0);

    boolean isEmpty() {
        return width == 0;
    }

    /** Box center as a phase in [0, 1). */
    double centerPhase(int bins) {
        double center = (startBin + width / 2.0) / bins;
        return center >= 1.0 ? center - 1.0 : center;
    }
}
