package com.exohunt.extractor;

import com.exohunt.error.DataFormatException;
import com.exohunt.model.FluxType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DelimitedTextFormatProvider")
class DelimitedTextFormatProviderTest {

    private final DelimitedTextFormatProvider provider = new DelimitedTextFormatProvider();

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("reads metadata, flux columns and quality from a CSV export")
    void readsCsv() {
        RawLightCurve raw = provider.load(bytes("""
                # MISSION = Kepler
                # KEPLERID = 757450
                TIME,PDCSAP_FLUX,SAP_FLUX,QUALITY
                131.5,1000.5,1010.0,0
                131.6,nan,1011.0,128
                """));

        assertThat(raw.time()).containsExactly(131.5, 131.6);
        assertThat(raw.has(FluxType.PDCSAP)).isTrue();
        assertThat(raw.has(FluxType.SAP)).isTrue();
        assertThat(raw.flux(FluxType.PDCSAP)[1]).isNaN();
        assertThat(raw.quality()).containsExactly(0, 128);
        assertThat(raw.meta("MISSION")).contains("Kepler");
        assertThat(raw.meta("KEPLERID")).contains("757450");
    }

    @Test
    @DisplayName("a bare flux column is read as PDCSAP; whitespace delimiters are accepted")
    void bareFluxColumn() {
        RawLightCurve raw = provider.load(bytes("""
                time   flux
                1.0    0.99
                2.0    1.01
                """));

        assertThat(raw.has(FluxType.PDCSAP)).isTrue();
        assertThat(raw.flux(FluxType.PDCSAP)).containsExactly(0.99, 1.01);
        assertThat(raw.quality()).isNull();
    }

    @Test
    @DisplayName("supports only content whose header has a time column")
    void supports() {
        assertThat(provider.supports(bytes("# c\ntime,flux\n1,1\n"))).isTrue();
        assertThat(provider.supports(bytes("SIMPLE  =                    T"))).isFalse();
    }

    @Test
    @DisplayName("ragged rows and unreadable numbers are DataFormatErrors")
    void malformed() {
        assertThatThrownBy(() -> provider.load(bytes("time,flux\n1.0\n")))
                .isInstanceOf(DataFormatException.class);
        assertThatThrownBy(() -> provider.load(bytes("time,flux\n1.0,abc\n")))
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("abc");
    }
}
