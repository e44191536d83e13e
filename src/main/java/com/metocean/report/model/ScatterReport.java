package com.metocean.report.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 计算完成的散点报表：工作表名称 -> 按行排列的散点表
 */
public class ScatterReport {

    private final String project;
    private final BinType binType;
    private final Map<String, List<List<ScatterTable>>> sheets = new LinkedHashMap<>();

    public ScatterReport(String project, BinType binType) {
        this.project = project;
        this.binType = binType;
    }

    public String getProject() { return project; }
    public BinType getBinType() { return binType; }

    public void addSheet(String name, List<List<ScatterTable>> rows) {
        if (sheets.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate scatter sheet name: " + name);
        }
        List<List<ScatterTable>> copy = new ArrayList<>();
        for (List<ScatterTable> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        sheets.put(name, Collections.unmodifiableList(copy));
    }

    public Map<String, List<List<ScatterTable>>> getSheets() {
        return Collections.unmodifiableMap(sheets);
    }

    public int tableCount() {
        int count = 0;
        for (List<List<ScatterTable>> rows : sheets.values()) {
            for (List<ScatterTable> row : rows) {
                count += row.size();
            }
        }
        return count;
    }
}
