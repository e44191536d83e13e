package com.metocean.report.core.impl;

import com.metocean.report.core.ProcessingContext;
import com.metocean.report.model.BinTable;
import com.metocean.report.model.BinType;
import com.metocean.report.model.ObservationDataset;

import java.util.Collections;
import java.util.Map;

/**
 * 处理上下文默认实现。
 * 封装单个处理步骤执行时所需的全部环境信息，同一次运行的各步骤共享数据集和分箱表。
 */
public class DefaultProcessingContext implements ProcessingContext {

    private final ObservationDataset dataset;
    private final BinTable binTable;
    private final BinType binType;
    private final Map<String, Object> parameters;

    public DefaultProcessingContext(ObservationDataset dataset,
                                    BinTable binTable,
                                    BinType binType,
                                    Map<String, Object> parameters) {
        this.dataset = dataset;
        this.binTable = binTable;
        this.binType = binType;
        this.parameters = parameters != null ? parameters : Collections.emptyMap();
    }

    @Override
    public ObservationDataset getDataset() {
        return dataset;
    }

    @Override
    public BinTable getBinTable() {
        return binTable;
    }

    @Override
    public BinType getBinType() {
        return binType;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getParameter(String paramName, T defaultValue) {
        Object value = parameters.get(paramName);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null) {
            Class<?> targetType = defaultValue.getClass();
            // 数值类型转换
            if (targetType == Double.class && value instanceof Number) {
                return (T) Double.valueOf(((Number) value).doubleValue());
            }
            if (targetType == Integer.class && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            }
            if (!targetType.isInstance(value)) {
                throw new IllegalArgumentException("Parameter '" + paramName + "' expects "
                        + targetType.getSimpleName() + ", got: " + value.getClass().getSimpleName());
            }
        }
        return (T) value;
    }
}
