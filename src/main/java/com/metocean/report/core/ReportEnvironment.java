package com.metocean.report.core;

import com.metocean.report.model.ObservationDataset;

import java.nio.file.Path;
import java.util.List;

/**
 * 运行时环境接口：报表运行的骨架和生命周期管理者。
 *
 * 采用构建者模式支持链式配置，将各组件注入后统一启动：
 * <pre>
 * DefaultReportEnvironment.initialize(config)
 *     .setProcessorManager(processorManager)
 *     .setTableExecutor(tableExecutor)
 *     .setReportWriter(reportWriter)
 *     .start();
 * </pre>
 */
public interface ReportEnvironment {

    ReportEnvironment setProcessorManager(ProcessorManager processorManager);

    ReportEnvironment setTableExecutor(TableExecutor tableExecutor);

    ReportEnvironment setReportWriter(ReportWriter reportWriter);

    /**
     * 校验组件完整性并进入运行状态
     */
    void start();

    /**
     * 对数据集执行处理计划，构建并输出全部报表。
     *
     * @param dataset 同步后的观测数据集
     * @return 生成的报表文件
     */
    List<Path> run(ObservationDataset dataset);

    /**
     * 关闭运行时环境，释放工作线程
     */
    void shutdown();
}
