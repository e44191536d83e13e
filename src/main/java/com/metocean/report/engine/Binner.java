package com.metocean.report.engine;

import com.metocean.report.model.BinAxis;
import com.metocean.report.model.BinType;
import com.metocean.report.model.DiscreteAxis;
import com.metocean.report.model.DiscreteColumn;
import org.apache.commons.math3.stat.StatUtils;

/**
 * 数值变量分箱。
 *
 * 分箱边界为 0, w, 2w, ...，直到该列的观测最大值，分箱数为 max(1, ceil(max / w))。
 * LEFT 闭合下标为 floor(v / w)，RIGHT 闭合下标为 ceil(v / w) - 1，v = 0 归入第一个分箱。
 * 为数据集赋值时下标被限制在 [0, 分箱数 - 1] 内，超出最后边界的值并入最高分箱。
 */
public final class Binner {

    /** 商值距整数小于此值时视为整数，吸收 0.3 / 0.1 一类的浮点误差 */
    private static final double SNAP = 1e-9;

    private Binner() {}

    /**
     * 未限制范围的分箱下标
     */
    public static int binIndex(double value, double width, BinType binType) {
        double q = snap(value / width);
        if (binType == BinType.RIGHT) {
            return q <= 0 ? 0 : (int) Math.ceil(q) - 1;
        }
        return (int) Math.floor(q);
    }

    /**
     * 值所在分箱的中心（保留4位小数）；NaN 返回 NaN
     */
    public static double bin(double value, double width, BinType binType) {
        if (Double.isNaN(value)) {
            return Double.NaN;
        }
        int index = binIndex(value, width, binType);
        return DiscreteAxis.roundLabel(index * width + width / 2);
    }

    /**
     * 由观测最大值确定分箱数；全部缺测时只有一个分箱
     */
    public static int binCount(double max, double width) {
        if (Double.isNaN(max) || max <= 0) {
            return 1;
        }
        return Math.max(1, (int) Math.ceil(snap(max / width)));
    }

    public static BinAxis axisFor(String variable, double[] values, double width) {
        double max = values.length == 0 ? Double.NaN : StatUtils.max(values);
        return new BinAxis(variable, width, binCount(max, width));
    }

    /**
     * 把整列映射为分箱位置，NaN 记为缺测
     */
    public static int[] positions(double[] values, BinAxis axis, BinType binType) {
        int last = axis.size() - 1;
        int[] positions = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                positions[i] = DiscreteColumn.MISSING;
            } else {
                int index = binIndex(values[i], axis.getWidth(), binType);
                positions[i] = Math.max(0, Math.min(last, index));
            }
        }
        return positions;
    }

    public static DiscreteColumn binColumn(String columnName, BinAxis axis, double[] values, BinType binType) {
        return new DiscreteColumn(columnName, axis, positions(values, axis, binType));
    }

    private static double snap(double q) {
        double nearest = Math.rint(q);
        return Math.abs(q - nearest) < SNAP ? nearest : q;
    }
}
