package com.metocean.report.core;

import com.metocean.report.model.ProcessorMetadata;

/**
 * 数据集处理器接口：处理管道中每一步的基础契约。
 *
 * 处理器在表格计算之前运行，向数据集追加推算列（如谱峰升高因子）
 * 或离散化列（"_bins"、"_sectors"），多个处理器按处理计划的顺序串联执行。
 *
 * 实现约定：
 * - 处理器实例无状态，所有输入输出都经过ProcessingContext
 * - 致命的数据问题以ReportException抛出，不得吞掉
 */
public interface DatasetProcessor {

    /**
     * 执行处理逻辑。
     *
     * @param context 处理上下文，提供数据集、步骤参数和分箱表
     */
    void execute(ProcessingContext context);

    /**
     * 返回处理器的元数据信息，
     * 包括名称、版本和参数定义，用于处理计划的参数校验。
     *
     * @return 处理器元数据
     */
    ProcessorMetadata getMetadata();
}
