package com.metocean.report;

import com.metocean.report.model.DiscreteAxis;
import com.metocean.report.model.DiscreteColumn;
import com.metocean.report.model.ObservationDataset;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用数据集构造工具
 */
public final class TestDatasets {

    public static final LocalDateTime START = LocalDateTime.of(2020, 1, 1, 0, 0);

    private TestDatasets() {}

    public static ObservationDataset hourly(int rows) {
        List<LocalDateTime> timestamps = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            timestamps.add(START.plusHours(i));
        }
        return new ObservationDataset(timestamps);
    }

    public static void discrete(ObservationDataset dataset, String name, DiscreteAxis axis, int... positions) {
        dataset.addDiscreteColumn(new DiscreteColumn(name, axis, positions));
    }
}
