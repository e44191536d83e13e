package com.metocean.report.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 散点报表中的一个工作表：名称 + 按行排列的表格定义
 */
public class ScatterSheet {

    /** Excel工作表名称长度上限 */
    public static final int MAX_NAME_LENGTH = 31;

    private final String name;
    private final List<List<ScatterRequest>> rows;

    public ScatterSheet(String name, List<List<ScatterRequest>> rows) {
        this.name = name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
        List<List<ScatterRequest>> copy = new ArrayList<>();
        for (List<ScatterRequest> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public String getName() { return name; }
    public List<List<ScatterRequest>> getRows() { return rows; }

    public int tableCount() {
        int count = 0;
        for (List<ScatterRequest> row : rows) {
            count += row.size();
        }
        return count;
    }
}
