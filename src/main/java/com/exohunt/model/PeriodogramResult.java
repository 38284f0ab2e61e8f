package com.exohunt.model;

import com.exohunt.error.DataFormatException;

/**
 * Lomb-Scargle power spectrum expressed over period.
 *
 * @param periods     Periods in days, ascending
 * @param power       Normalized power per period, in [0, 1]
 * @param bestPeriod  Period of maximum power
 * @param bestPower   Maximum power
 */
public record PeriodogramResult(double[] periods, double[] power, double bestPeriod, double bestPower) {

    public PeriodogramResult {
        if (periods.length != power.length) throw new DataFormatException("Periods and power lengths differ");
    }
}
