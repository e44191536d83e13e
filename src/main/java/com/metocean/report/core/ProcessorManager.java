package com.metocean.report.core;

import com.metocean.report.model.ProcessingPlan;
import com.metocean.report.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * 处理器管理器接口：系统的处理器注册表。
 *
 * 负责处理器的注册、卸载、查询和参数校验。
 */
public interface ProcessorManager {

    /**
     * 注册一个处理器。重复的processorId将被拒绝。
     *
     * @param processorId 处理器唯一标识
     * @param processor   处理器实例
     * @return 注册是否成功
     */
    boolean registerProcessor(String processorId, DatasetProcessor processor);

    /**
     * 卸载指定处理器。
     *
     * @param processorId 处理器唯一标识
     * @return 卸载是否成功
     */
    boolean unregisterProcessor(String processorId);

    /**
     * @return 处理器实例；未找到返回null
     */
    DatasetProcessor getProcessor(String processorId);

    /**
     * @return 全部已注册的处理器
     */
    List<DatasetProcessor> getAllProcessors();

    /**
     * 校验处理器是否已注册及其参数是否合规。
     *
     * 校验内容包括：
     * - 必选参数是否缺失
     * - 参数类型是否匹配
     * - 数值参数是否在合法范围内
     * - 枚举参数是否为合法选项
     *
     * @param processorId 处理器唯一标识
     * @param parameters  待校验的参数集合
     * @return 详细的校验结果
     */
    ValidationResult validateProcessor(String processorId, Map<String, Object> parameters);

    /**
     * 逐步校验整个处理计划，错误信息以步骤为前缀合并。
     *
     * @param plan 处理计划
     * @return 合并后的校验结果
     */
    ValidationResult validatePlan(ProcessingPlan plan);
}
