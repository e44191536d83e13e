package com.metocean.report.model;

/**
 * 单一海况分解的NSS汇总表。
 *
 * 四维结构 [风向扇区 0..Nw][浪向扇区 0..Nv][风速分箱][4]，
 * 扇区0表示该维度全向（不过滤）。最后一维依次为
 * Hs、Tp、谱峰升高因子γ、出现概率。无观测的单元四个值均为NaN。
 * 涌浪表的风向维度只有全向一行。
 */
public class NssTable {

    public static final int HS = 0;
    public static final int TP = 1;
    public static final int GAMMA = 2;
    public static final int PROBABILITY = 3;
    public static final int COMPONENTS = 4;

    private final SeaState seaState;
    private final int windSectors;
    private final int waveSectors;
    private final BinAxis speedAxis;
    private final double[][][][] values;

    public NssTable(SeaState seaState, int windSectors, int waveSectors,
                    BinAxis speedAxis, double[][][][] values) {
        int windRows = seaState.isWindDirectional() ? windSectors + 1 : 1;
        if (values.length != windRows || values[0].length != waveSectors + 1
                || values[0][0].length != speedAxis.size()) {
            throw new IllegalArgumentException("NSS values do not match table shape for " + seaState);
        }
        this.seaState = seaState;
        this.windSectors = windSectors;
        this.waveSectors = waveSectors;
        this.speedAxis = speedAxis;
        this.values = new double[values.length][][][];
        for (int w = 0; w < values.length; w++) {
            this.values[w] = new double[values[w].length][][];
            for (int v = 0; v < values[w].length; v++) {
                this.values[w][v] = new double[values[w][v].length][];
                for (int b = 0; b < values[w][v].length; b++) {
                    this.values[w][v][b] = values[w][v][b].clone();
                }
            }
        }
    }

    public SeaState getSeaState() { return seaState; }
    public int getWindSectors() { return windSectors; }
    public int getWaveSectors() { return waveSectors; }
    public BinAxis getSpeedAxis() { return speedAxis; }

    /**
     * 风向维度上实际存在的行数（涌浪表为1）
     */
    public int getWindRowCount() {
        return values.length;
    }

    public boolean hasWindSector(int windSector) {
        return windSector >= 0 && windSector < values.length;
    }

    /**
     * @param windSector 风向扇区，0为全向
     * @param waveSector 浪向扇区，0为全向
     * @param bin        风速分箱位置
     * @param component  {@link #HS}、{@link #TP}、{@link #GAMMA} 或 {@link #PROBABILITY}
     */
    public double get(int windSector, int waveSector, int bin, int component) {
        if (!hasWindSector(windSector)) {
            throw new IllegalArgumentException(seaState + " table has no wind sector " + windSector);
        }
        return values[windSector][waveSector][bin][component];
    }

    /**
     * 一个(风向, 浪向)组合下的完整表格副本 [风速分箱][4]
     */
    public double[][] slice(int windSector, int waveSector) {
        if (!hasWindSector(windSector)) {
            throw new IllegalArgumentException(seaState + " table has no wind sector " + windSector);
        }
        double[][] source = values[windSector][waveSector];
        double[][] copy = new double[source.length][];
        for (int b = 0; b < source.length; b++) {
            copy[b] = source[b].clone();
        }
        return copy;
    }

    /**
     * 一个(风向, 浪向)组合下各风速分箱概率之和，忽略NaN
     */
    public double probabilitySum(int windSector, int waveSector) {
        double sum = 0;
        for (double[] row : values[windSector][waveSector]) {
            if (!Double.isNaN(row[PROBABILITY])) {
                sum += row[PROBABILITY];
            }
        }
        return sum;
    }
}
