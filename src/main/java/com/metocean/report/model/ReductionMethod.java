package com.metocean.report.model;

import java.util.Locale;

/**
 * NSS表格中每个单元的集中趋势统计方法
 */
public enum ReductionMethod {
    MEAN,
    MEDIAN;

    public static ReductionMethod parse(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "mean":
                return MEAN;
            case "median":
                return MEDIAN;
            default:
                return null;
        }
    }
}
