package com.metocean.report.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 分箱表：变量名 -> 分箱轴。
 * 由分箱处理器在数据处理阶段一次性发布，NSS和散点表据此确定坐标轴标签。
 */
public class BinTable {

    private final Map<String, BinAxis> axes = new LinkedHashMap<>();

    public void publish(BinAxis axis) {
        axes.put(axis.getVariable(), axis);
    }

    public BinAxis get(String variable) {
        return axes.get(variable);
    }

    public boolean contains(String variable) {
        return axes.containsKey(variable);
    }

    /**
     * 变量的有序分箱中心序列
     *
     * @throws IllegalArgumentException 变量未分箱时抛出
     */
    public double[] centers(String variable) {
        BinAxis axis = axes.get(variable);
        if (axis == null) {
            throw new IllegalArgumentException("No bins published for variable '" + variable + "'");
        }
        return axis.labels();
    }

    public Map<String, BinAxis> asMap() {
        return Collections.unmodifiableMap(axes);
    }

    public int size() {
        return axes.size();
    }
}
