package com.metocean.report.model;

/**
 * 数值变量的分箱轴。
 * 边界为 0, w, 2w, ...，第 i 个分箱中心为 i*w + w/2。
 */
public class BinAxis implements DiscreteAxis {

    private final String variable;
    private final double width;
    private final int count;

    public BinAxis(String variable, double width, int count) {
        if (!(width > 0)) {
            throw new IllegalArgumentException("Bin width must be positive, got: " + width);
        }
        if (count < 1) {
            throw new IllegalArgumentException("Bin axis needs at least one bin, got: " + count);
        }
        this.variable = variable;
        this.width = width;
        this.count = count;
    }

    @Override
    public String getVariable() { return variable; }

    public double getWidth() { return width; }

    @Override
    public int size() { return count; }

    @Override
    public double label(int position) {
        return DiscreteAxis.roundLabel(position * width + width / 2);
    }

    @Override
    public double lowerBound(int position) {
        return DiscreteAxis.roundLabel(position * width);
    }

    @Override
    public double upperBound(int position) {
        return DiscreteAxis.roundLabel((position + 1) * width);
    }

    @Override
    public boolean isDirectional() { return false; }

    @Override
    public int positionOf(double label) {
        if (Double.isNaN(label)) {
            return -1;
        }
        long candidate = Math.round((label - width / 2) / width);
        if (candidate < 0 || candidate >= count) {
            return -1;
        }
        int position = (int) candidate;
        return label(position) == DiscreteAxis.roundLabel(label) ? position : -1;
    }

    @Override
    public String toString() {
        return "BinAxis{" + variable + ", width=" + width + ", bins=" + count + "}";
    }
}
