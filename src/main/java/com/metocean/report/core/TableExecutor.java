package com.metocean.report.core;

import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.TableJob;

import java.util.List;

/**
 * 表格执行器接口：在工作线程池上并行构建相互独立的表格。
 *
 * 执行流程：
 *   checkJobInput → executeAll（按提交顺序返回结果）
 *
 * 所有作业共享同一个只读数据集，任一作业失败则整次运行失败。
 */
public interface TableExecutor {

    /**
     * 检查作业所需的列在数据集中是否都存在。
     *
     * @param job     待检查的作业
     * @param dataset 数据集
     * @return 输入是否满足要求
     */
    boolean checkJobInput(TableJob<?> job, ObservationDataset dataset);

    /**
     * 并行执行一组作业，等待全部完成。
     *
     * @param jobs    作业列表
     * @param dataset 只读数据集
     * @param <T>     结果类型
     * @return 与提交顺序一致的结果列表
     * @throws com.metocean.report.ReportException 输入不满足或作业失败时抛出
     */
    <T> List<T> executeAll(List<TableJob<T>> jobs, ObservationDataset dataset);

    /**
     * 关闭工作线程池
     */
    void shutdown();
}
