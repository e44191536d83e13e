package com.metocean.report.model;

/**
 * 方向扇区轴。扇区编号 1..N，扇区1跨越 0°/360°。
 */
public class SectorAxis implements DiscreteAxis {

    private final String variable;
    private final int sectors;

    public SectorAxis(String variable, int sectors) {
        if (sectors < 1) {
            throw new IllegalArgumentException("Sector count must be at least 1, got: " + sectors);
        }
        this.variable = variable;
        this.sectors = sectors;
    }

    @Override
    public String getVariable() { return variable; }

    @Override
    public int size() { return sectors; }

    public double getSectorWidth() {
        return 360.0 / sectors;
    }

    /** 位置 i 对应扇区编号 i+1 */
    @Override
    public double label(int position) {
        return position + 1;
    }

    @Override
    public double lowerBound(int position) {
        double w = getSectorWidth();
        if (position == 0) {
            return DiscreteAxis.roundLabel(360 - w / 2);
        }
        return DiscreteAxis.roundLabel(w / 2 + (position - 1) * w);
    }

    @Override
    public double upperBound(int position) {
        double w = getSectorWidth();
        return DiscreteAxis.roundLabel(w / 2 + position * w);
    }

    @Override
    public boolean isDirectional() { return true; }

    @Override
    public int positionOf(double label) {
        if (Double.isNaN(label) || label != Math.rint(label)) {
            return -1;
        }
        int sector = (int) label;
        return (sector >= 1 && sector <= sectors) ? sector - 1 : -1;
    }

    @Override
    public String toString() {
        return "SectorAxis{" + variable + ", sectors=" + sectors + "}";
    }
}
