package org.flightplot.export;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ColorEncodingTest {

    @Test
    void paletteSizeIsValidated() {
        assertThat(ColorEncoding.reducedPalette(2).colors()).isEqualTo(2);
        assertThat(ColorEncoding.reducedPalette(256).isReducedPalette()).isTrue();
        assertThatThrownBy(() -> ColorEncoding.reducedPalette(1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorEncoding.reducedPalette(257)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void displayNames() {
        assertThat(ColorEncoding.reducedPalette(16)).hasToString("ReducedPalette(16)");
        assertThat(ColorEncoding.fullColor()).hasToString("FullColor");
        assertThat(ColorEncoding.fullColor().isReducedPalette()).isFalse();
    }
}
