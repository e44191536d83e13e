package com.metocean.report.core.impl;

import com.metocean.report.core.DatasetProcessor;
import com.metocean.report.core.ProcessorManager;
import com.metocean.report.model.ParameterDefinition;
import com.metocean.report.model.ProcessingPlan;
import com.metocean.report.model.ProcessorMetadata;
import com.metocean.report.model.StepConfig;
import com.metocean.report.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 处理器管理器默认实现。
 * 使用ConcurrentHashMap存储处理器注册表。
 */
public class DefaultProcessorManager implements ProcessorManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcessorManager.class);

    /** 处理器注册表：processorId -> DatasetProcessor实例 */
    private final ConcurrentHashMap<String, DatasetProcessor> processorRegistry = new ConcurrentHashMap<>();

    @Override
    public boolean registerProcessor(String processorId, DatasetProcessor processor) {
        if (processorId == null || processorId.isBlank()) {
            log.error("Cannot register processor with null or blank id");
            return false;
        }
        if (processor == null) {
            log.error("Cannot register null processor for id: {}", processorId);
            return false;
        }

        DatasetProcessor existing = processorRegistry.putIfAbsent(processorId, processor);
        if (existing != null) {
            log.warn("Processor '{}' is already registered, registration rejected.", processorId);
            return false;
        }

        log.debug("Processor '{}' registered. Version: {}", processorId, processor.getMetadata().getVersion());
        return true;
    }

    @Override
    public boolean unregisterProcessor(String processorId) {
        if (processorId == null || processorId.isBlank()) {
            return false;
        }
        if (processorRegistry.remove(processorId) == null) {
            log.warn("Processor '{}' not found, nothing to unregister.", processorId);
            return false;
        }
        log.debug("Processor '{}' unregistered.", processorId);
        return true;
    }

    @Override
    public DatasetProcessor getProcessor(String processorId) {
        return processorRegistry.get(processorId);
    }

    @Override
    public List<DatasetProcessor> getAllProcessors() {
        return new ArrayList<>(processorRegistry.values());
    }

    @Override
    public ValidationResult validateProcessor(String processorId, Map<String, Object> parameters) {
        ValidationResult result = new ValidationResult();

        DatasetProcessor processor = processorRegistry.get(processorId);
        if (processor == null) {
            result.addError("No processor registered under id '" + processorId + "'");
            return result;
        }

        ProcessorMetadata metadata = processor.getMetadata();
        if (metadata == null || metadata.getParameterDefinitions() == null) {
            return result;
        }

        Map<String, Object> params = (parameters != null) ? parameters : Collections.emptyMap();
        Set<String> declared = new HashSet<>();
        for (ParameterDefinition def : metadata.getParameterDefinitions()) {
            declared.add(def.getName());
            Object value = params.get(def.getName());
            if (value == null) {
                if (def.isRequired()) {
                    result.addError("Processor '" + processorId + "' needs parameter '" + def.getName() + "'");
                }
                continue;
            }
            String problem = checkValue(def, value);
            if (problem != null) {
                result.addError(problem);
            }
        }

        // 未声明的参数不影响执行，只提示
        for (String key : params.keySet()) {
            if (!declared.contains(key)) {
                result.addWarning("Processor '" + processorId + "' does not take parameter '" + key + "', ignored");
            }
        }
        return result;
    }

    /**
     * 按参数定义检查单个取值
     *
     * @return 问题描述；取值合法时返回 null
     */
    private static String checkValue(ParameterDefinition def, Object value) {
        String name = "'" + def.getName() + "'";
        switch (def.getType()) {
            case NUMBER:
                if (!(value instanceof Number)) {
                    return name + " must be a number, got " + value.getClass().getSimpleName();
                }
                return checkRange(def, ((Number) value).doubleValue());
            case INTEGER:
                if (!(value instanceof Integer || value instanceof Long)) {
                    return name + " must be a whole number, got " + value.getClass().getSimpleName();
                }
                return checkRange(def, ((Number) value).doubleValue());
            case STRING:
                if (!(value instanceof String)) {
                    return name + " must be a column name, got " + value.getClass().getSimpleName();
                }
                return ((String) value).isBlank() ? name + " must not be blank" : null;
            case ENUM:
                if (!(value instanceof String)
                        || (def.getEnumValues() != null && !def.getEnumValues().contains(value))) {
                    return name + " must be one of " + def.getEnumValues() + ", got '" + value + "'";
                }
                return null;
            default:
                throw new IllegalStateException("Unhandled parameter type " + def.getType());
        }
    }

    @Override
    public ValidationResult validatePlan(ProcessingPlan plan) {
        ValidationResult result = new ValidationResult();
        for (StepConfig step : plan.getSteps()) {
            result.merge("step " + step.getOrder() + " (" + step.getProcessorId() + ")",
                    validateProcessor(step.getProcessorId(), step.getParameters()));
        }
        for (String warning : result.getWarnings()) {
            log.warn("Processing plan: {}", warning);
        }
        return result;
    }

    private static String checkRange(ParameterDefinition def, double value) {
        if (def.getMinValue() != null && value < def.getMinValue()) {
            return "'" + def.getName() + "' = " + value + " is below the lower limit " + def.getMinValue();
        }
        if (def.getMaxValue() != null && value > def.getMaxValue()) {
            return "'" + def.getName() + "' = " + value + " is above the upper limit " + def.getMaxValue();
        }
        return null;
    }
}
