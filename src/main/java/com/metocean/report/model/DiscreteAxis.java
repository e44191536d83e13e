package com.metocean.report.model;

/**
 * 离散化坐标轴：分箱或方向扇区的有序标签序列。
 *
 * 引擎内部一律使用从0开始的位置索引（position）做分组和比较，
 * 标签值（分箱中心或扇区编号）只在呈现时使用。
 */
public interface DiscreteAxis {

    /** 比较标签值时保留的小数位数 */
    int LABEL_DECIMALS = 4;

    /**
     * 源变量名，如 WS、WnD
     */
    String getVariable();

    /**
     * 轴上的位置数量
     */
    int size();

    /**
     * 指定位置的标签：分箱中心或扇区编号
     */
    double label(int position);

    /**
     * 指定位置的下边界
     */
    double lowerBound(int position);

    /**
     * 指定位置的上边界
     */
    double upperBound(int position);

    /**
     * 是否为方向扇区轴
     */
    boolean isDirectional();

    /**
     * 由标签值反查位置，按 {@link #LABEL_DECIMALS} 位小数比较。
     *
     * @param label 分箱中心或扇区编号
     * @return 位置索引；不在轴上时返回-1
     */
    int positionOf(double label);

    default double[] labels() {
        double[] labels = new double[size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = label(i);
        }
        return labels;
    }

    static double roundLabel(double value) {
        double scale = Math.pow(10, LABEL_DECIMALS);
        return Math.round(value * scale) / scale;
    }
}
