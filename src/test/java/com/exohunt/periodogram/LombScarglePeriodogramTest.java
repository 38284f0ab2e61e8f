package com.exohunt.periodogram;

import com.exohunt.error.InsufficientDataException;
import com.exohunt.model.LightCurveSeries;
import com.exohunt.model.PeriodogramResult;
import com.exohunt.support.SyntheticLightCurves;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("LombScarglePeriodogram")
class LombScarglePeriodogramTest {

    private final LombScarglePeriodogram periodogram = new LombScarglePeriodogram(5, 20000);

    @Test
    @DisplayName("recovers the period of a noisy sinusoid")
    void sinusoidPeriod() {
        LightCurveSeries series = SyntheticLightCurves.sinusoid(11L, 2000, 60.0, 0.001, 2.7, 0.01);

        PeriodogramResult result = periodogram.compute(series);

        assertThat(result.bestPeriod()).isCloseTo(2.7, within(2.7 * 0.01));
        assertThat(result.bestPower()).isGreaterThan(0.9);
    }

    @Test
    @DisplayName("periods ascend and power stays within [0, 1]")
    void shape() {
        LightCurveSeries series = SyntheticLightCurves.sinusoid(12L, 800, 30.0, 0.002, 4.1, 0.005);

        PeriodogramResult result = periodogram.compute(series);

        double[] periods = result.periods();
        for (int i = 1; i < periods.length; i++) assertThat(periods[i]).isGreaterThan(periods[i - 1]);
        for (double p : result.power()) assertThat(p).isBetween(0.0, 1.0);
        assertThat(result.bestPower()).isEqualTo(Arrays.stream(result.power()).max().orElseThrow());
    }

    @Test
    @DisplayName("irregular sampling still finds the signal")
    void irregularSampling() {
        LightCurveSeries regular = SyntheticLightCurves.sinusoid(13L, 3000, 45.0, 0.001, 1.9, 0.01);
        boolean[] keep = new boolean[regular.size()];
        for (int i = 0; i < keep.length; i++) keep[i] = (i * 7919) % 10 < 6;

        PeriodogramResult result = periodogram.compute(regular.select(keep));

        assertThat(result.bestPeriod()).isCloseTo(1.9, within(1.9 * 0.01));
    }

    @Test
    @DisplayName("fewer than three points or constant flux is InsufficientDataError")
    void insufficient() {
        assertThatThrownBy(() -> periodogram.compute(new double[]{0.0, 1.0}, new double[]{1.0, 1.1}))
                .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> periodogram.compute(new double[]{0.0, 1.0, 2.0, 3.0}, new double[]{1.0, 1.0, 1.0, 1.0}))
                .isInstanceOf(InsufficientDataException.class);
    }
}
