package com.metocean.report.model;

/**
 * 海况分解类型及其在数据集中对应的列名
 */
public enum SeaState {
    TOTAL("NSS Total sea", 1, "WvD_sectors", "Hs", "Tp", "G"),
    WIND_SEA("NSS Wind sea", 2, "WvD_W_sectors", "Hs_W", "Tp_W", "G_W"),
    SWELL("NSS Swell sea", 3, "WvD_S_sectors", "Hs_S", "Tp_S", "G_S");

    private final String sheetName;
    private final int tableNumber;
    private final String waveSectorColumn;
    private final String heightColumn;
    private final String periodColumn;
    private final String gammaColumn;

    SeaState(String sheetName, int tableNumber, String waveSectorColumn,
             String heightColumn, String periodColumn, String gammaColumn) {
        this.sheetName = sheetName;
        this.tableNumber = tableNumber;
        this.waveSectorColumn = waveSectorColumn;
        this.heightColumn = heightColumn;
        this.periodColumn = periodColumn;
        this.gammaColumn = gammaColumn;
    }

    public String getSheetName() { return sheetName; }
    public int getTableNumber() { return tableNumber; }
    public String getWaveSectorColumn() { return waveSectorColumn; }
    public String getHeightColumn() { return heightColumn; }
    public String getPeriodColumn() { return periodColumn; }
    public String getGammaColumn() { return gammaColumn; }

    /** 涌浪与风向无关，只保留风向全向切片 */
    public boolean isWindDirectional() {
        return this != SWELL;
    }
}
