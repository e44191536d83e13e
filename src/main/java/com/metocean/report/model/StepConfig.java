package com.metocean.report.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 处理管道中单个步骤的配置
 */
public class StepConfig {
    /** 处理器唯一标识 */
    private final String processorId;
    /** 步骤在管道中的执行顺序（从小到大） */
    private final int order;
    /** 处理器参数 */
    private final Map<String, Object> parameters;

    public StepConfig(String processorId, int order, Map<String, Object> parameters) {
        this.processorId = processorId;
        this.order = order;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
    }

    public String getProcessorId() { return processorId; }
    public int getOrder() { return order; }
    public Map<String, Object> getParameters() { return parameters; }

    @Override
    public String toString() {
        return processorId + "#" + order + parameters;
    }
}
