package com.metocean.report.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BinAxisTest {

    @Test
    void boundsAndCentres() {
        BinAxis axis = new BinAxis("Hs", 0.5, 4);

        assertThat(axis.labels()).containsExactly(0.25, 0.75, 1.25, 1.75);
        assertThat(axis.lowerBound(2)).isEqualTo(1.0);
        assertThat(axis.upperBound(3)).isEqualTo(2.0);
        assertThat(axis.isDirectional()).isFalse();
    }

    @Test
    void labelsAreRoundedToFourDecimals() {
        BinAxis axis = new BinAxis("SV", 0.1, 5);

        assertThat(axis.label(2)).isEqualTo(0.25);
        assertThat(axis.upperBound(2)).isEqualTo(0.3);
    }

    @Test
    void positionOfRoundTripsLabels() {
        BinAxis axis = new BinAxis("SV", 0.1, 5);

        for (int i = 0; i < axis.size(); i++) {
            assertThat(axis.positionOf(axis.label(i))).isEqualTo(i);
        }
        assertThat(axis.positionOf(0.3)).isEqualTo(-1);
        assertThat(axis.positionOf(0.55)).isEqualTo(-1);
        assertThat(axis.positionOf(Double.NaN)).isEqualTo(-1);
    }

    @Test
    void rejectsDegenerateAxes() {
        assertThatThrownBy(() -> new BinAxis("WS", 0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BinAxis("WS", 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
