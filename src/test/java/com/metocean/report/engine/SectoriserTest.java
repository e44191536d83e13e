package com.metocean.report.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.metocean.report.model.BinType;
import com.metocean.report.model.DiscreteColumn;
import com.metocean.report.model.SectorAxis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class SectoriserTest {

    @ParameterizedTest
    @CsvSource({
            "359, 1",
            "1, 1",
            "0, 1",
            "345, 1",
            "344.99, 12",
            "14.99, 1",
            "15, 2",
            "30, 2",
            "180, 7",
            "-10, 1",
            "375, 2"
    })
    void leftClosedTwelveSectors(double angle, int expected) {
        assertThat(Sectoriser.sectorise(angle, 12, BinType.LEFT)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "345, 12",
            "345.01, 1",
            "15, 1",
            "15.01, 2",
            "0, 1",
            "45, 2"
    })
    void rightClosedTwelveSectors(double angle, int expected) {
        assertThat(Sectoriser.sectorise(angle, 12, BinType.RIGHT)).isEqualTo(expected);
    }

    @ParameterizedTest
    @EnumSource(BinType.class)
    void everyAngleLandsInRange(BinType binType) {
        for (int sectors : new int[] {1, 4, 8, 12, 16, 36}) {
            for (double angle = -720; angle <= 720; angle += 0.5) {
                assertThat(Sectoriser.sectorise(angle, sectors, binType)).isBetween(1, sectors);
            }
        }
    }

    @Test
    void nanIsMissing() {
        assertThat(Sectoriser.sectorise(Double.NaN, 12, BinType.LEFT)).isEqualTo(DiscreteColumn.MISSING);
    }

    @Test
    void rejectsZeroSectors() {
        assertThatThrownBy(() -> Sectoriser.sectorise(10, 0, BinType.LEFT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normaliseWrapsIntoFullCircle() {
        assertThat(Sectoriser.normalise(360)).isEqualTo(0);
        assertThat(Sectoriser.normalise(-90)).isEqualTo(270);
        assertThat(Sectoriser.normalise(725)).isEqualTo(5);
    }

    @Test
    void sectorColumnStoresZeroBasedPositions() {
        SectorAxis axis = new SectorAxis("WnD", 4);

        DiscreteColumn column = Sectoriser.sectorColumn("WnD_sectors", axis,
                new double[] {0, 90, 200, Double.NaN}, BinType.LEFT);

        assertThat(column.position(0)).isEqualTo(0);
        assertThat(column.position(1)).isEqualTo(1);
        assertThat(column.position(2)).isEqualTo(2);
        assertThat(column.position(3)).isEqualTo(DiscreteColumn.MISSING);
        assertThat(column.label(1)).isEqualTo(2);
    }
}
