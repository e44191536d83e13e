package com.metocean.report.processors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.metocean.report.TestDatasets;
import com.metocean.report.core.impl.DefaultProcessingContext;
import com.metocean.report.model.BinTable;
import com.metocean.report.model.BinType;
import com.metocean.report.model.ObservationDataset;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

class PeakEnhancementProcessorTest {

    private static DefaultProcessingContext context(ObservationDataset dataset, Map<String, Object> params) {
        return new DefaultProcessingContext(dataset, new BinTable(), BinType.LEFT, params);
    }

    @Test
    void derivesFromHeightAndPeriod() {
        ObservationDataset dataset = TestDatasets.hourly(2);
        dataset.addColumn("Hs_W", new double[] {4.0, 1.0});
        dataset.addColumn("Tp_W", new double[] {6.0, 12.0});
        Map<String, Object> params = new HashMap<>();
        params.put("mode", PeakEnhancementProcessor.MODE_DERIVE);
        params.put("target", "G_W");
        params.put("height", "Hs_W");
        params.put("period", "Tp_W");

        new PeakEnhancementProcessor().execute(context(dataset, params));

        assertThat(dataset.getColumn("G_W")).containsExactly(5.0, 1.0);
    }

    @Test
    void fillsConstantForSwell() {
        ObservationDataset dataset = TestDatasets.hourly(3);
        Map<String, Object> params = new HashMap<>();
        params.put("mode", PeakEnhancementProcessor.MODE_CONSTANT);
        params.put("target", "G_S");
        params.put("value", 7.5);

        new PeakEnhancementProcessor().execute(context(dataset, params));

        assertThat(dataset.getColumn("G_S")).containsOnly(7.5);
    }

    @Test
    void constantDefaultsToTen() {
        ObservationDataset dataset = TestDatasets.hourly(1);
        Map<String, Object> params = new HashMap<>();
        params.put("mode", PeakEnhancementProcessor.MODE_CONSTANT);
        params.put("target", "G_S");

        new PeakEnhancementProcessor().execute(context(dataset, params));

        assertThat(dataset.getColumn("G_S")).containsExactly(10.0);
    }

    @Test
    void derivationNeedsSourceColumns() {
        ObservationDataset dataset = TestDatasets.hourly(1);
        Map<String, Object> params = new HashMap<>();
        params.put("mode", PeakEnhancementProcessor.MODE_DERIVE);
        params.put("target", "G");

        assertThatThrownBy(() -> new PeakEnhancementProcessor().execute(context(dataset, params)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'G'");
    }
}
