package com.metocean.report.core.impl;

import com.metocean.report.ReportException;
import com.metocean.report.core.TableExecutor;
import com.metocean.report.model.JobStatus;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.TableJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 表格执行器默认实现。
 * 使用工作窃取线程池实现表格级并行，各作业只读共享数据集。
 */
public class DefaultTableExecutor implements TableExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultTableExecutor.class);

    /** 工作窃取线程池，自动平衡各线程负载 */
    private final ForkJoinPool workerPool;

    /** 当前已提交未结束的作业，用于重复提交检测 */
    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();

    /** 执行统计 */
    private final AtomicInteger totalExecuted = new AtomicInteger(0);
    private final AtomicInteger totalFailed = new AtomicInteger(0);

    public DefaultTableExecutor(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got: " + parallelism);
        }
        this.workerPool = new ForkJoinPool(
                parallelism,
                ForkJoinPool.defaultForkJoinWorkerThreadFactory,
                (t, e) -> log.error("Uncaught exception in worker thread {}: {}",
                        t.getName(), e.getMessage(), e),
                true  // asyncMode=true，作业之间互不依赖
        );
        log.info("TableExecutor initialized. Parallelism: {}", parallelism);
    }

    @Override
    public boolean checkJobInput(TableJob<?> job, ObservationDataset dataset) {
        for (String column : job.getRequiredColumns()) {
            if (!dataset.hasColumn(column)) {
                job.setLastErrorMessage("Required column '" + column + "' is missing");
                log.error("Job '{}' cannot run: required column '{}' is missing", job.getJobId(), column);
                return false;
            }
        }
        return true;
    }

    @Override
    public <T> List<T> executeAll(List<TableJob<T>> jobs, ObservationDataset dataset) {
        for (TableJob<T> job : jobs) {
            if (!checkJobInput(job, dataset)) {
                job.setStatus(JobStatus.SKIPPED);
                throw ReportException.precondition("Table job '" + job.getJobId() + "' cannot run: "
                        + job.getLastErrorMessage());
            }
        }

        List<Future<T>> futures = new ArrayList<>(jobs.size());
        for (TableJob<T> job : jobs) {
            futures.add(submit(job, dataset));
        }

        List<T> results = new ArrayList<>(jobs.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelFrom(futures, jobs, i);
                throw new ReportException(ReportException.ErrorKind.COMPUTATION,
                        "Interrupted while waiting for table job '" + jobs.get(i).getJobId() + "'", e);
            } catch (ExecutionException e) {
                cancelFrom(futures, jobs, i + 1);
                Throwable cause = e.getCause();
                if (cause instanceof ReportException) {
                    throw (ReportException) cause;
                }
                throw new ReportException(ReportException.ErrorKind.COMPUTATION,
                        "Table job '" + jobs.get(i).getJobId() + "' failed: " + cause.getMessage(), cause);
            }
        }
        return results;
    }

    private <T> Future<T> submit(TableJob<T> job, ObservationDataset dataset) {
        String jobId = job.getJobId();
        if (!runningJobs.add(jobId)) {
            throw new IllegalStateException("Table job '" + jobId + "' is already running");
        }
        job.setStatus(JobStatus.QUEUED);
        Future<T> future = workerPool.submit(() -> {
            long startTime = System.currentTimeMillis();
            try {
                job.setStatus(JobStatus.RUNNING);
                T result = job.build(dataset);
                job.setStatus(JobStatus.COMPLETED);
                totalExecuted.incrementAndGet();
                job.setElapsedMs(System.currentTimeMillis() - startTime);
                log.debug("Table '{}' complete in {}ms", jobId, job.getElapsedMs());
                return result;
            } catch (RuntimeException e) {
                totalFailed.incrementAndGet();
                job.setLastErrorMessage(e.getMessage());
                job.setStatus(JobStatus.FAILED);
                log.error("Table '{}' failed: {}", jobId, e.getMessage());
                throw e;
            } finally {
                runningJobs.remove(jobId);
            }
        });
        return future;
    }

    /**
     * 取消尚未结束的作业；未开始即被取消的作业不会进入finally，需在此清理
     */
    private <T> void cancelFrom(List<Future<T>> futures, List<TableJob<T>> jobs, int from) {
        for (int i = from; i < futures.size(); i++) {
            if (futures.get(i).cancel(true)) {
                runningJobs.remove(jobs.get(i).getJobId());
            }
        }
    }

    @Override
    public void shutdown() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 30s, forcing shutdown.");
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
        log.info("TableExecutor shut down. Executed: {}, failed: {}", totalExecuted.get(), totalFailed.get());
    }

    /** 获取执行统计 */
    public int getTotalExecuted() { return totalExecuted.get(); }
    public int getTotalFailed() { return totalFailed.get(); }
    public int getActiveJobCount() { return runningJobs.size(); }
}
