package com.metocean.report.model;

import java.util.List;

/**
 * 处理器参数定义，用于在管道运行前校验步骤参数
 */
public class ParameterDefinition {

    /**
     * 参数类型
     */
    public enum Type {
        NUMBER,
        INTEGER,
        STRING,
        ENUM
    }

    private String name;
    private String description;
    private Type type;
    private boolean required;
    private Object defaultValue;
    /** 数值型参数的取值范围下限 */
    private Double minValue;
    /** 数值型参数的取值范围上限 */
    private Double maxValue;
    /** 枚举型参数的可选值列表 */
    private List<String> enumValues;

    public ParameterDefinition() {}

    public ParameterDefinition(String name, Type type, boolean required, String description) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.description = description;
    }

    public ParameterDefinition range(Double minValue, Double maxValue) {
        this.minValue = minValue;
        this.maxValue = maxValue;
        return this;
    }

    public ParameterDefinition options(List<String> enumValues) {
        this.enumValues = enumValues;
        return this;
    }

    public ParameterDefinition defaultsTo(Object defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public Type getType() { return type; }
    public void setType(Type type) { this.type = type; }
    public boolean isRequired() { return required; }
    public void setRequired(boolean required) { this.required = required; }
    public Object getDefaultValue() { return defaultValue; }
    public void setDefaultValue(Object defaultValue) { this.defaultValue = defaultValue; }
    public Double getMinValue() { return minValue; }
    public void setMinValue(Double minValue) { this.minValue = minValue; }
    public Double getMaxValue() { return maxValue; }
    public void setMaxValue(Double maxValue) { this.maxValue = maxValue; }
    public List<String> getEnumValues() { return enumValues; }
    public void setEnumValues(List<String> enumValues) { this.enumValues = enumValues; }
}
