package com.metocean.report.core.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.metocean.report.ReportException;
import com.metocean.report.TestDatasets;
import com.metocean.report.model.JobStatus;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.TableJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

class DefaultTableExecutorTest {

    private DefaultTableExecutor executor;
    private ObservationDataset dataset;

    @BeforeEach
    void setUp() {
        executor = new DefaultTableExecutor(4);
        dataset = TestDatasets.hourly(3);
        dataset.addColumn("Hs", new double[] {1, 2, 3});
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void resultsKeepSubmissionOrder() {
        List<TableJob<Integer>> jobs = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int index = i;
            jobs.add(new TableJob<>("table-" + i, Set.of("Hs"), ds -> {
                sleepQuietly((20 - index) % 5);
                return index;
            }));
        }

        List<Integer> results = executor.executeAll(jobs, dataset);

        assertThat(results).hasSize(20);
        for (int i = 0; i < 20; i++) {
            assertThat(results.get(i)).isEqualTo(i);
            assertThat(jobs.get(i).getStatus()).isEqualTo(JobStatus.COMPLETED);
        }
        assertThat(executor.getTotalExecuted()).isEqualTo(20);
        assertThat(executor.getActiveJobCount()).isZero();
    }

    @Test
    void missingColumnFailsBeforeAnyJobRuns() {
        AtomicInteger runs = new AtomicInteger();
        TableJob<Integer> ok = new TableJob<>("ok", Set.of("Hs"), ds -> runs.incrementAndGet());
        TableJob<Integer> broken = new TableJob<>("broken", Set.of("Tp"), ds -> runs.incrementAndGet());

        assertThatThrownBy(() -> executor.executeAll(List.of(ok, broken), dataset))
                .isInstanceOfSatisfying(ReportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ReportException.ErrorKind.PRECONDITION))
                .hasMessageContaining("broken")
                .hasMessageContaining("'Tp'");
        assertThat(broken.getStatus()).isEqualTo(JobStatus.SKIPPED);
        assertThat(runs.get()).isZero();
    }

    @Test
    void reportExceptionFromJobPropagatesUnchanged() {
        TableJob<Integer> failing = new TableJob<>("failing", Collections.emptySet(), ds -> {
            throw ReportException.precondition("bad input");
        });

        assertThatThrownBy(() -> executor.executeAll(List.of(failing), dataset))
                .isInstanceOfSatisfying(ReportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ReportException.ErrorKind.PRECONDITION))
                .hasMessageContaining("bad input");
        assertThat(failing.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failing.getLastErrorMessage()).isEqualTo("bad input");
        assertThat(executor.getTotalFailed()).isEqualTo(1);
    }

    @Test
    void otherFailuresBecomeComputationErrors() {
        TableJob<Integer> failing = new TableJob<>("exploding", Collections.emptySet(), ds -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> executor.executeAll(List.of(failing), dataset))
                .isInstanceOfSatisfying(ReportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ReportException.ErrorKind.COMPUTATION))
                .hasMessageContaining("exploding")
                .hasMessageContaining("boom");
    }

    @Test
    void emptyJobListYieldsEmptyResult() {
        assertThat(executor.executeAll(new ArrayList<TableJob<String>>(), dataset)).isEmpty();
    }

    @Test
    void rejectsNonPositiveParallelism() {
        assertThatThrownBy(() -> new DefaultTableExecutor(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
