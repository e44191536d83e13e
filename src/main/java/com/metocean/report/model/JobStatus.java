package com.metocean.report.model;

/**
 * 表格计算作业状态
 */
public enum JobStatus {
    /** 已创建，尚未提交 */
    CREATED,
    /** 已提交到线程池，等待执行 */
    QUEUED,
    /** 正在执行 */
    RUNNING,
    /** 执行成功 */
    COMPLETED,
    /** 执行失败 */
    FAILED,
    /** 输入数据不满足要求，未执行 */
    SKIPPED
}
