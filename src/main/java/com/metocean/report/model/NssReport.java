package com.metocean.report.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 一次报表运行产生的全部NSS表格（总海况，以及可选的风浪、涌浪）
 */
public class NssReport {

    private final String project;
    private final BinType binType;
    private final double hubHeight;
    private final Map<SeaState, NssTable> tables;

    public NssReport(String project, BinType binType, double hubHeight, Map<SeaState, NssTable> tables) {
        if (!tables.containsKey(SeaState.TOTAL)) {
            throw new IllegalArgumentException("NSS report requires a total sea table");
        }
        this.project = project;
        this.binType = binType;
        this.hubHeight = hubHeight;
        this.tables = Collections.unmodifiableMap(new EnumMap<>(tables));
    }

    public String getProject() { return project; }
    public BinType getBinType() { return binType; }
    public double getHubHeight() { return hubHeight; }

    public NssTable getTable(SeaState seaState) {
        return tables.get(seaState);
    }

    /** 按 TOTAL、WIND_SEA、SWELL 顺序排列 */
    public Map<SeaState, NssTable> getTables() {
        return tables;
    }
}
