package com.metocean.report.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 数据处理计划：按顺序执行的处理步骤列表。
 * 由配置推导而来，描述需要推算哪些列、对哪些列分箱或划分扇区。
 */
public class ProcessingPlan {

    private final List<StepConfig> steps = new ArrayList<>();

    public ProcessingPlan addStep(String processorId, Map<String, Object> parameters) {
        steps.add(new StepConfig(processorId, steps.size(), parameters));
        return this;
    }

    /** 按order升序返回 */
    public List<StepConfig> getSteps() {
        List<StepConfig> sorted = new ArrayList<>(steps);
        sorted.sort(Comparator.comparingInt(StepConfig::getOrder));
        return Collections.unmodifiableList(sorted);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
