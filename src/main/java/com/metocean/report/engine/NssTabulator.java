package com.metocean.report.engine;

import com.metocean.report.model.BinAxis;
import com.metocean.report.model.DiscreteColumn;
import com.metocean.report.model.NssTable;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.ReductionMethod;
import com.metocean.report.model.SeaState;
import org.apache.commons.math3.stat.descriptive.UnivariateStatistic;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.ResizableDoubleArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * NSS交叉汇总。
 *
 * 对数据集做一次遍历，每行按 (全向/风向扇区) × (全向/浪向扇区) 计入至多四个单元，
 * 再对每个单元求 Hs、Tp、γ 的均值或中位数，以及出现概率 = 单元行数 / 数据集总行数。
 * 扇区0表示该维度不过滤。涌浪只累计风向全向一行。
 */
public class NssTabulator {

    private static final Logger log = LoggerFactory.getLogger(NssTabulator.class);

    public static final String SPEED_BIN_COLUMN = "WS_bins";
    public static final String WIND_SECTOR_COLUMN = "WnD_sectors";

    private final ReductionMethod method;

    public NssTabulator(ReductionMethod method) {
        this.method = method;
    }

    public NssTable tabulate(ObservationDataset dataset, SeaState seaState) {
        DiscreteColumn speed = dataset.getDiscreteColumn(SPEED_BIN_COLUMN);
        DiscreteColumn wind = dataset.getDiscreteColumn(WIND_SECTOR_COLUMN);
        DiscreteColumn wave = dataset.getDiscreteColumn(seaState.getWaveSectorColumn());
        BinAxis speedAxis = (BinAxis) speed.getAxis();

        double[] hs = dataset.getColumn(seaState.getHeightColumn());
        double[] tp = dataset.getColumn(seaState.getPeriodColumn());
        double[] gamma = dataset.hasColumn(seaState.getGammaColumn())
                ? dataset.getColumn(seaState.getGammaColumn()) : null;

        int windSectors = wind.getAxis().size();
        int waveSectors = wave.getAxis().size();
        int windRows = seaState.isWindDirectional() ? windSectors + 1 : 1;
        int bins = speedAxis.size();

        Cell[][][] cells = new Cell[windRows][waveSectors + 1][bins];
        int[] windSlots = new int[2];
        int[] waveSlots = new int[2];

        for (int row = 0; row < dataset.size(); row++) {
            int b = speed.position(row);
            if (b == DiscreteColumn.MISSING) {
                continue;
            }
            int windCount = slots(windSlots, seaState.isWindDirectional() ? wind.position(row) : DiscreteColumn.MISSING);
            int waveCount = slots(waveSlots, wave.position(row));
            for (int i = 0; i < windCount; i++) {
                for (int j = 0; j < waveCount; j++) {
                    Cell cell = cells[windSlots[i]][waveSlots[j]][b];
                    if (cell == null) {
                        cell = new Cell();
                        cells[windSlots[i]][waveSlots[j]][b] = cell;
                    }
                    cell.add(hs[row], tp[row], gamma == null ? Double.NaN : gamma[row]);
                }
            }
        }

        UnivariateStatistic reducer = method == ReductionMethod.MEAN ? new Mean() : new Median();
        double total = dataset.size();
        double[][][][] values = new double[windRows][waveSectors + 1][bins][];
        for (int w = 0; w < windRows; w++) {
            for (int v = 0; v <= waveSectors; v++) {
                for (int b = 0; b < bins; b++) {
                    Cell cell = cells[w][v][b];
                    values[w][v][b] = cell == null ? emptyCell() : cell.reduce(reducer, total);
                }
            }
        }
        log.debug("Tabulated {} over {} rows: {} wind rows x {} wave sectors x {} speed bins",
                seaState, dataset.size(), windRows, waveSectors + 1, bins);
        return new NssTable(seaState, windSectors, waveSectors, speedAxis, values);
    }

    /**
     * 行所属的扇区槽位：总是包含全向0，有效扇区位置 p 对应槽位 p+1
     */
    private static int slots(int[] slots, int position) {
        slots[0] = 0;
        if (position == DiscreteColumn.MISSING) {
            return 1;
        }
        slots[1] = position + 1;
        return 2;
    }

    private static double[] emptyCell() {
        double[] cell = new double[NssTable.COMPONENTS];
        Arrays.fill(cell, Double.NaN);
        return cell;
    }

    /**
     * 单元累加器，各列的NaN在累加时跳过
     */
    private static class Cell {
        private final ResizableDoubleArray hs = new ResizableDoubleArray();
        private final ResizableDoubleArray tp = new ResizableDoubleArray();
        private final ResizableDoubleArray gamma = new ResizableDoubleArray();
        private int count;

        void add(double h, double t, double g) {
            count++;
            if (!Double.isNaN(h)) hs.addElement(h);
            if (!Double.isNaN(t)) tp.addElement(t);
            if (!Double.isNaN(g)) gamma.addElement(g);
        }

        double[] reduce(UnivariateStatistic reducer, double total) {
            double[] result = new double[NssTable.COMPONENTS];
            result[NssTable.HS] = reduce(reducer, hs);
            result[NssTable.TP] = reduce(reducer, tp);
            result[NssTable.GAMMA] = reduce(reducer, gamma);
            result[NssTable.PROBABILITY] = count / total;
            return result;
        }

        private static double reduce(UnivariateStatistic reducer, ResizableDoubleArray values) {
            if (values.getNumElements() == 0) {
                return Double.NaN;
            }
            return reducer.evaluate(values.getElements());
        }
    }
}
