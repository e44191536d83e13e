package com.metocean.report.model;

import com.metocean.report.ReportException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 同步后的观测数据集，每行对应一个时间戳。
 *
 * 原始连续变量按列名保存为double数组；数据处理阶段追加的分箱/扇区列
 * 以 {@link DiscreteColumn} 保存。表格计算阶段只读取，不修改数据集。
 */
public class ObservationDataset {

    private final List<LocalDateTime> timestamps;
    private final Map<String, double[]> columns = new LinkedHashMap<>();
    private final Map<String, DiscreteColumn> discreteColumns = new LinkedHashMap<>();

    public ObservationDataset(List<LocalDateTime> timestamps) {
        Set<LocalDateTime> seen = new HashSet<>();
        for (LocalDateTime ts : timestamps) {
            if (!seen.add(ts)) {
                throw ReportException.precondition("Duplicate timestamp in dataset: " + ts);
            }
        }
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    public void addColumn(String name, double[] values) {
        if (values.length != timestamps.size()) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                    + " values, dataset has " + timestamps.size() + " rows");
        }
        columns.put(name, values.clone());
    }

    public void addDiscreteColumn(DiscreteColumn column) {
        if (column.size() != timestamps.size()) {
            throw new IllegalArgumentException("Column '" + column.getName() + "' has " + column.size()
                    + " values, dataset has " + timestamps.size() + " rows");
        }
        discreteColumns.put(column.getName(), column);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name) || discreteColumns.containsKey(name);
    }

    /**
     * 获取原始数值列的副本
     *
     * @throws IllegalArgumentException 列不存在时抛出
     */
    public double[] getColumn(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Column '" + name + "' not found in dataset");
        }
        return values.clone();
    }

    public double value(String name, int row) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Column '" + name + "' not found in dataset");
        }
        return values[row];
    }

    /**
     * @throws IllegalArgumentException 列不存在时抛出
     */
    public DiscreteColumn getDiscreteColumn(String name) {
        DiscreteColumn column = discreteColumns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Discrete column '" + name + "' not found in dataset");
        }
        return column;
    }

    public Set<String> getColumnNames() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    public Set<String> getDiscreteColumnNames() {
        return Collections.unmodifiableSet(discreteColumns.keySet());
    }
}
