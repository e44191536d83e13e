package com.metocean.report.engine;

import com.metocean.report.ReportException;
import com.metocean.report.model.ObservationDataset;

/**
 * JONSWAP谱峰升高因子 γ 的推算（DNV-GL 经验公式）。
 * x = Tp / sqrt(Hs)：x <= 3.6 时 γ = 5；x >= 5 时 γ = 1；其间 γ = exp(5.75 - 1.15x)。
 */
public final class PeakEnhancement {

    public static final double LOWER_LIMIT = 3.6;
    public static final double UPPER_LIMIT = 5.0;

    private PeakEnhancement() {}

    /**
     * @throws ReportException Hs 非正或为NaN、Tp 为NaN时抛出
     */
    public static double derive(double hs, double tp) {
        if (Double.isNaN(hs) || hs <= 0 || Double.isNaN(tp)) {
            throw ReportException.precondition("Cannot derive peak enhancement from Hs=" + hs + ", Tp=" + tp);
        }
        double x = tp / Math.sqrt(hs);
        if (x <= LOWER_LIMIT) {
            return 5;
        }
        if (x >= UPPER_LIMIT) {
            return 1;
        }
        return Math.exp(5.75 - 1.15 * x);
    }

    /**
     * 对数据集逐行推算，错误信息中带出错行的时间戳
     */
    public static double[] deriveColumn(ObservationDataset dataset, String heightColumn, String periodColumn) {
        double[] hs = dataset.getColumn(heightColumn);
        double[] tp = dataset.getColumn(periodColumn);
        double[] gamma = new double[hs.length];
        for (int i = 0; i < hs.length; i++) {
            if (Double.isNaN(hs[i]) || hs[i] <= 0 || Double.isNaN(tp[i])) {
                throw ReportException.precondition("Cannot derive peak enhancement at "
                        + dataset.getTimestamps().get(i) + ": " + heightColumn + "=" + hs[i]
                        + ", " + periodColumn + "=" + tp[i]);
            }
            gamma[i] = derive(hs[i], tp[i]);
        }
        return gamma;
    }
}
