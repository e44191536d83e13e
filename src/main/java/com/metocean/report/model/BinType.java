package com.metocean.report.model;

import java.util.Locale;

/**
 * 分箱边界闭合方式。
 * LEFT 对应 [lower, upper)，RIGHT 对应 (lower, upper]。
 */
public enum BinType {
    LEFT("Lower (>=)", "Upper (<)"),
    RIGHT("Lower (>)", "Upper (<=)");

    private final String lowerHeader;
    private final String upperHeader;

    BinType(String lowerHeader, String upperHeader) {
        this.lowerHeader = lowerHeader;
        this.upperHeader = upperHeader;
    }

    public String getLowerHeader() { return lowerHeader; }
    public String getUpperHeader() { return upperHeader; }

    /**
     * 解析配置值，无法识别时返回null，由调用方决定回退策略
     */
    public static BinType parse(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "left":
                return LEFT;
            case "right":
                return RIGHT;
            default:
                return null;
        }
    }
}
