package com.exohunt.model;

import com.exohunt.error.DataFormatException;

import java.util.List;
import java.util.Optional;

/**
 * Full outcome of a box-least-squares search.
 *
 * <p>{@code periods}/{@code power} hold the first-pass detection statistic for every trial
 * period and back a periodogram-style display even when nothing is detected.
 *
 * @param periods       Trial periods in days, ascending
 * @param power         Normalized detection statistic per trial period, in [0, 1]
 * @param candidates    Candidates ranked by SNR, highest first, including sub-threshold ones
 * @param snrThreshold  Threshold a candidate must meet to count as detected
 * @param gridCapped    True when {@code periods} is coarser than the full frequency resolution
 *                      because of the trial-period cap; candidates are still measured at full
 *                      resolution
 */
public record TransitSearchResult(double[] periods,
                                  double[] power,
                                  List<TransitCandidate> candidates,
                                  double snrThreshold,
                                  boolean gridCapped) {

    public TransitSearchResult {
        if (periods.length != power.length) throw new DataFormatException("Periods and power lengths differ");
        candidates = List.copyOf(candidates);
    }

    /**
     * Candidates whose SNR meets the threshold, highest SNR first.
     */
    public List<TransitCandidate> detected() {
        return candidates.stream().filter(c -> c.meets(snrThreshold)).toList();
    }

    public Optional<TransitCandidate> best() {
        return candidates.stream().findFirst();
    }
}
