package com.metocean.report.model;

/**
 * 离散化后的列（"_bins" 或 "_sectors"），每行保存其在坐标轴上的位置。
 * 缺测值保存为 {@link #MISSING}，不与任何分箱或扇区匹配。
 */
public class DiscreteColumn {

    public static final int MISSING = -1;

    private final String name;
    private final DiscreteAxis axis;
    private final int[] positions;

    public DiscreteColumn(String name, DiscreteAxis axis, int[] positions) {
        for (int position : positions) {
            if (position != MISSING && (position < 0 || position >= axis.size())) {
                throw new IllegalArgumentException("Position " + position + " of column '" + name
                        + "' is outside axis " + axis);
            }
        }
        this.name = name;
        this.axis = axis;
        this.positions = positions.clone();
    }

    public String getName() { return name; }
    public DiscreteAxis getAxis() { return axis; }

    public int size() {
        return positions.length;
    }

    public int position(int row) {
        return positions[row];
    }

    /**
     * 指定行的呈现值：分箱中心或扇区编号；缺测返回NaN
     */
    public double label(int row) {
        int position = positions[row];
        return position == MISSING ? Double.NaN : axis.label(position);
    }
}
