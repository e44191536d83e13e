package com.metocean.report.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SectorAxisTest {

    @Test
    void firstSectorStraddlesNorth() {
        SectorAxis axis = new SectorAxis("WnD", 12);

        assertThat(axis.getSectorWidth()).isEqualTo(30.0);
        assertThat(axis.lowerBound(0)).isEqualTo(345.0);
        assertThat(axis.upperBound(0)).isEqualTo(15.0);
        assertThat(axis.lowerBound(1)).isEqualTo(15.0);
        assertThat(axis.upperBound(11)).isEqualTo(345.0);
    }

    @Test
    void labelsAreSectorNumbers() {
        SectorAxis axis = new SectorAxis("WvD", 8);

        assertThat(axis.label(0)).isEqualTo(1);
        assertThat(axis.positionOf(8)).isEqualTo(7);
        assertThat(axis.positionOf(9)).isEqualTo(-1);
        assertThat(axis.positionOf(2.5)).isEqualTo(-1);
        assertThat(axis.isDirectional()).isTrue();
    }
}
