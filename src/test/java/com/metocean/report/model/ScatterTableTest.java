package com.metocean.report.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

class ScatterTableTest {

    private static final double NaN = Double.NaN;

    @Test
    void sumsIgnoreEmptyCells() {
        ScatterTable table = new ScatterTable(new ScatterRequest("WnD_sectors", "WS_bins"),
                new SectorAxis("WnD", 2), new BinAxis("WS", 1, 3), new double[][] {
                        {0.1, NaN},
                        {NaN, NaN},
                        {0.3, 0.2}});

        assertThat(table.rowSums()).containsExactly(new double[] {0.1, 0, 0.5}, within(1e-12));
        assertThat(table.columnSums()).containsExactly(new double[] {0.4, 0.2}, within(1e-12));
        assertThat(table.total()).isCloseTo(0.6, within(1e-12));
    }

    @Test
    void shapeMustMatchAxes() {
        assertThatThrownBy(() -> new ScatterTable(new ScatterRequest("a", "b"),
                new SectorAxis("WnD", 2), new BinAxis("WS", 1, 1), new double[][] {{0.1}}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requestKeepsAtMostTwoActiveFilters() {
        ScatterRequest request = new ScatterRequest("x", "y", new ColumnFilter("WnD_sectors", 1), new ColumnFilter(null, 0));

        assertThat(request.getFilters()).hasSize(1);
        assertThatThrownBy(() -> new ScatterRequest("x", "y",
                new ColumnFilter("a", 1), new ColumnFilter("b", 1), new ColumnFilter("c", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sheetNamesAreTruncated() {
        List<List<ScatterRequest>> rows = Collections.emptyList();
        ScatterSheet sheet = new ScatterSheet("A sheet name that is far too long for Excel", rows);

        assertThat(sheet.getName()).hasSize(ScatterSheet.MAX_NAME_LENGTH);
    }
}
