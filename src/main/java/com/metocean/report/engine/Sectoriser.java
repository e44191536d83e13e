package com.metocean.report.engine;

import com.metocean.report.model.BinType;
import com.metocean.report.model.DiscreteColumn;
import com.metocean.report.model.SectorAxis;

/**
 * 方向角划分扇区。扇区宽度 w = 360 / N，扇区1以正北为中心，跨越 0°/360°。
 */
public final class Sectoriser {

    private static final double SNAP = 1e-9;

    private Sectoriser() {}

    /**
     * 角度归一化到 [0, 360)
     */
    public static double normalise(double angle) {
        double a = angle % 360;
        if (a < 0) {
            a += 360;
        }
        return a >= 360 ? 0 : a;
    }

    /**
     * @return 扇区编号 1..N；角度为NaN时返回 {@link DiscreteColumn#MISSING}
     */
    public static int sectorise(double angle, int sectors, BinType binType) {
        if (Double.isNaN(angle)) {
            return DiscreteColumn.MISSING;
        }
        if (sectors < 1) {
            throw new IllegalArgumentException("Sector count must be at least 1, got: " + sectors);
        }
        double w = 360.0 / sectors;
        double a = normalise(angle);
        int sector;
        if (binType == BinType.RIGHT) {
            if (a > 360 - w / 2) {
                return 1;
            }
            sector = (int) Math.ceil(snap(a / w + 0.5));
        } else {
            if (a >= 360 - w / 2) {
                return 1;
            }
            sector = (int) Math.floor(snap((a + w / 2) / w)) + 1;
        }
        return Math.max(1, Math.min(sectors, sector));
    }

    public static DiscreteColumn sectorColumn(String columnName, SectorAxis axis, double[] angles, BinType binType) {
        int[] positions = new int[angles.length];
        for (int i = 0; i < angles.length; i++) {
            int sector = sectorise(angles[i], axis.size(), binType);
            positions[i] = sector == DiscreteColumn.MISSING ? DiscreteColumn.MISSING : sector - 1;
        }
        return new DiscreteColumn(columnName, axis, positions);
    }

    private static double snap(double q) {
        double nearest = Math.rint(q);
        return Math.abs(q - nearest) < SNAP ? nearest : q;
    }
}
