package com.metocean.report.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一张散点表的定义：横轴变量、纵轴变量和至多两个过滤条件
 */
public class ScatterRequest {

    public static final int MAX_FILTERS = 2;

    private final String xVariable;
    private final String yVariable;
    private final List<ColumnFilter> filters;

    public ScatterRequest(String xVariable, String yVariable, ColumnFilter... filters) {
        if (xVariable == null || yVariable == null) {
            throw new IllegalArgumentException("Scatter request needs both axis variables");
        }
        if (filters.length > MAX_FILTERS) {
            throw new IllegalArgumentException("At most " + MAX_FILTERS + " filters are supported, got: "
                    + filters.length);
        }
        this.xVariable = xVariable;
        this.yVariable = yVariable;
        List<ColumnFilter> active = new ArrayList<>();
        for (ColumnFilter filter : filters) {
            if (filter != null && filter.isActive()) {
                active.add(filter);
            }
        }
        this.filters = Collections.unmodifiableList(active);
    }

    public String getXVariable() { return xVariable; }
    public String getYVariable() { return yVariable; }

    /** 仅包含生效的过滤条件 */
    public List<ColumnFilter> getFilters() { return filters; }

    public String describe() {
        StringBuilder sb = new StringBuilder(yVariable).append(" Vs. ").append(xVariable);
        for (ColumnFilter filter : filters) {
            sb.append(" [").append(filter).append("]");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ScatterRequest{" + describe() + "}";
    }
}
