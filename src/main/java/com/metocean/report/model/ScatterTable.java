package com.metocean.report.model;

/**
 * 二维联合概率表 [纵轴位置][横轴位置]。
 * 概率恰为0的单元保存为NaN，以区分“无数据”与“很小的概率”。
 */
public class ScatterTable {

    private final ScatterRequest request;
    private final DiscreteAxis xAxis;
    private final DiscreteAxis yAxis;
    private final double[][] values;

    public ScatterTable(ScatterRequest request, DiscreteAxis xAxis, DiscreteAxis yAxis, double[][] values) {
        if (values.length != yAxis.size()) {
            throw new IllegalArgumentException("Scatter table has " + values.length + " rows, y axis has "
                    + yAxis.size());
        }
        this.request = request;
        this.xAxis = xAxis;
        this.yAxis = yAxis;
        this.values = new double[values.length][];
        for (int y = 0; y < values.length; y++) {
            if (values[y].length != xAxis.size()) {
                throw new IllegalArgumentException("Scatter row " + y + " has " + values[y].length
                        + " columns, x axis has " + xAxis.size());
            }
            this.values[y] = values[y].clone();
        }
    }

    public ScatterRequest getRequest() { return request; }
    public DiscreteAxis getXAxis() { return xAxis; }
    public DiscreteAxis getYAxis() { return yAxis; }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return xAxis.size();
    }

    public double get(int y, int x) {
        return values[y][x];
    }

    public double[] rowSums() {
        double[] sums = new double[values.length];
        for (int y = 0; y < values.length; y++) {
            for (double v : values[y]) {
                if (!Double.isNaN(v)) sums[y] += v;
            }
        }
        return sums;
    }

    public double[] columnSums() {
        double[] sums = new double[xAxis.size()];
        for (double[] row : values) {
            for (int x = 0; x < row.length; x++) {
                if (!Double.isNaN(row[x])) sums[x] += row[x];
            }
        }
        return sums;
    }

    public double total() {
        double total = 0;
        for (double sum : rowSums()) {
            total += sum;
        }
        return total;
    }
}
