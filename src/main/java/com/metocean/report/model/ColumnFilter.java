package com.metocean.report.model;

/**
 * 散点表的等值过滤条件：列名 + 标签值（分箱中心或扇区编号）。
 * 列名为空、值为0或NaN时视为不过滤。
 */
public class ColumnFilter {

    private final String column;
    private final double value;

    public ColumnFilter(String column, double value) {
        this.column = column;
        this.value = value;
    }

    public String getColumn() { return column; }
    public double getValue() { return value; }

    public boolean isActive() {
        return column != null && !column.isBlank() && value != 0 && !Double.isNaN(value);
    }

    @Override
    public String toString() {
        if (!isActive()) {
            return "none";
        }
        return column + " = " + (value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value));
    }
}
