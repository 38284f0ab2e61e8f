package com.exohunt.model;

import com.exohunt.error.DataFormatException;
import com.exohunt.error.InsufficientDataException;
import com.exohunt.error.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LightCurveSeries")
class LightCurveSeriesTest {

    @Test
    @DisplayName("mismatched lengths are DataFormatError")
    void lengthMismatch() {
        assertThatThrownBy(() -> LightCurveSeries.of(new double[]{1, 2, 3}, new double[]{1, 2}))
                .isInstanceOf(DataFormatException.class);
        assertThatThrownBy(() -> new LightCurveSeries(new double[]{1, 2}, new double[]{1, 1}, new int[]{0},
                "Kepler", FluxType.PDCSAP, 0, null))
                .isInstanceOf(DataFormatException.class);
    }

    @Test
    @DisplayName("non-ascending or duplicate times are DataFormatError")
    void ordering() {
        assertThatThrownBy(() -> LightCurveSeries.of(new double[]{1, 1, 2}, new double[]{1, 1, 1}))
                .isInstanceOf(DataFormatException.class);
        assertThatThrownBy(() -> LightCurveSeries.of(new double[]{2, 1}, new double[]{1, 1}))
                .isInstanceOf(DataFormatException.class);
    }

    @Test
    @DisplayName("flux with no finite value is InsufficientDataError")
    void allNonFiniteFlux() {
        double[] time = {0.0, 0.1, 0.2, 0.3};
        double[] flux = {Double.NaN, Double.NaN, Double.POSITIVE_INFINITY, Double.NaN};

        assertThatThrownBy(() -> LightCurveSeries.of(time, flux))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("No finite flux");
    }

    @Test
    @DisplayName("a single non-finite time or flux is DataFormatError")
    void partlyNonFinite() {
        assertThatThrownBy(() -> LightCurveSeries.of(new double[]{0.0, 0.1, 0.2}, new double[]{1.0, Double.NaN, 1.0}))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("index 1");
        assertThatThrownBy(() -> LightCurveSeries.of(new double[]{0.0, Double.POSITIVE_INFINITY}, new double[]{1.0, 1.0}))
                .isInstanceOf(DataFormatException.class);
    }

    @Test
    @DisplayName("arrays are copied on construction")
    void defensiveCopy() {
        double[] flux = {1.0, 1.0};
        LightCurveSeries series = LightCurveSeries.of(new double[]{0.0, 1.0}, flux);
        flux[0] = 5.0;

        assertThat(series.flux()[0]).isEqualTo(1.0);
        assertThat(series.mission()).isEqualTo(LightCurveSeries.UNKNOWN_MISSION);
    }

    @Test
    @DisplayName("select keeps only the marked points")
    void select() {
        LightCurveSeries series = LightCurveSeries.of(new double[]{0, 1, 2, 3}, new double[]{1, 2, 3, 4});

        LightCurveSeries picked = series.select(new boolean[]{true, false, true, false});

        assertThat(picked.time()).containsExactly(0.0, 2.0);
        assertThat(picked.flux()).containsExactly(1.0, 3.0);
        assertThat(picked.durationDays()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("uploads with the same bytes share an identity")
    void uploadIdentity() {
        UploadedLightCurve a = UploadedLightCurve.ofText("a.csv", "time,flux\n1,1\n");
        UploadedLightCurve b = UploadedLightCurve.ofText("b.csv", "time,flux\n1,1\n");

        assertThat(a.identity()).isEqualTo(b.identity()).startsWith("upload:");
        assertThat(new ArchiveLightCurve(757450).identity()).isEqualTo("kic:757450");
    }

    @Test
    @DisplayName("uploads compare by content and keep their own copy of the bytes")
    void uploadEquality() {
        byte[] bytes = "time,flux\n1,1\n".getBytes(StandardCharsets.UTF_8);
        UploadedLightCurve a = new UploadedLightCurve("a.csv", bytes);
        UploadedLightCurve b = UploadedLightCurve.ofText("b.csv", "time,flux\n1,1\n");
        String identity = a.identity();
        bytes[0] = 'X';

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.identity()).isEqualTo(identity);
        assertThat(a.content()[0]).isEqualTo((byte) 't');
        assertThat(a).isNotEqualTo(UploadedLightCurve.ofText("a.csv", "time,flux\n1,2\n"));
    }

    @Test
    @DisplayName("invalid value records fail with typed errors")
    void typedRecordValidation() {
        assertThatThrownBy(() -> new UploadedLightCurve("empty.csv", new byte[0]))
                .isInstanceOf(DataFormatException.class);
        assertThatThrownBy(() -> new ArchiveLightCurve(0))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> new AnalysisRequest(null, null))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> new TransitCandidate(-1.0, 0.0, 100.0, 2.0, 8.0, 10, TransitCandidate.BLS))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> new SubResult<String>(null, null))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> new PeriodogramResult(new double[]{1.0}, new double[0], 1.0, 0.0))
                .isInstanceOf(DataFormatException.class);
    }
}
