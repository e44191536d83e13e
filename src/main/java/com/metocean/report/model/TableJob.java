package com.metocean.report.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * 表格计算作业，封装一次独立的表格构建及其运行时状态。
 * 构建函数只读取数据集，作业之间没有共享的可变状态。
 *
 * @param <T> 构建结果类型（NSS表或散点表）
 */
public class TableJob<T> {
    private final String jobId;
    private final Set<String> requiredColumns;
    private final Function<ObservationDataset, T> builder;

    private volatile JobStatus status = JobStatus.CREATED;
    private volatile long elapsedMs;
    private volatile String lastErrorMessage;

    public TableJob(String jobId, Set<String> requiredColumns, Function<ObservationDataset, T> builder) {
        this.jobId = jobId;
        this.requiredColumns = Collections.unmodifiableSet(new LinkedHashSet<>(requiredColumns));
        this.builder = builder;
    }

    public T build(ObservationDataset dataset) {
        return builder.apply(dataset);
    }

    public String getJobId() { return jobId; }
    public Set<String> getRequiredColumns() { return requiredColumns; }
    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }
    public long getElapsedMs() { return elapsedMs; }
    public void setElapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; }
    public String getLastErrorMessage() { return lastErrorMessage; }
    public void setLastErrorMessage(String lastErrorMessage) { this.lastErrorMessage = lastErrorMessage; }

    @Override
    public String toString() {
        return "TableJob{" + jobId + ", " + status + "}";
    }
}
