package com.metocean.report.core.impl;

import com.metocean.report.ReportConfig;
import com.metocean.report.ReportException;
import com.metocean.report.core.DatasetProcessor;
import com.metocean.report.core.ProcessorManager;
import com.metocean.report.core.ReportEnvironment;
import com.metocean.report.core.ReportWriter;
import com.metocean.report.core.TableExecutor;
import com.metocean.report.engine.NssTabulator;
import com.metocean.report.engine.ScatterBuilder;
import com.metocean.report.engine.ScatterReportPlanner;
import com.metocean.report.model.BinTable;
import com.metocean.report.model.ColumnFilter;
import com.metocean.report.model.Feature;
import com.metocean.report.model.NssReport;
import com.metocean.report.model.NssTable;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.ProcessingPlan;
import com.metocean.report.model.ScatterReport;
import com.metocean.report.model.ScatterRequest;
import com.metocean.report.model.ScatterSheet;
import com.metocean.report.model.ScatterTable;
import com.metocean.report.model.SeaState;
import com.metocean.report.model.StepConfig;
import com.metocean.report.model.TableJob;
import com.metocean.report.model.ValidationResult;
import com.metocean.report.processors.ProcessingPlanFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行时环境默认实现。
 * 管理各组件的生命周期，按 处理计划 → NSS表 → 散点表 → 输出 的顺序完成一次报表运行。
 */
public class DefaultReportEnvironment implements ReportEnvironment {

    private static final Logger log = LoggerFactory.getLogger(DefaultReportEnvironment.class);

    private final ReportConfig config;

    private ProcessorManager processorManager;
    private TableExecutor tableExecutor;
    private ReportWriter reportWriter;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private DefaultReportEnvironment(ReportConfig config) {
        this.config = config;
    }

    public static DefaultReportEnvironment initialize(ReportConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("ReportConfig is required");
        }
        log.info("Initializing metocean report environment for project '{}'...", config.getProject());
        return new DefaultReportEnvironment(config);
    }

    @Override
    public DefaultReportEnvironment setProcessorManager(ProcessorManager processorManager) {
        this.processorManager = processorManager;
        return this;
    }

    @Override
    public DefaultReportEnvironment setTableExecutor(TableExecutor tableExecutor) {
        this.tableExecutor = tableExecutor;
        return this;
    }

    @Override
    public DefaultReportEnvironment setReportWriter(ReportWriter reportWriter) {
        this.reportWriter = reportWriter;
        return this;
    }

    @Override
    public void start() {
        validateComponents();
        if (!running.compareAndSet(false, true)) {
            log.warn("Environment is already running, ignoring duplicate start.");
            return;
        }
        log.info("Report environment started with {} registered processors.",
                processorManager.getAllProcessors().size());
    }

    @Override
    public List<Path> run(ObservationDataset dataset) {
        if (!running.get()) {
            throw new IllegalStateException("Environment is not running, call start() first");
        }
        if (dataset.isEmpty()) {
            throw ReportException.precondition("Dataset is empty, nothing to report");
        }

        BinTable binTable = process(dataset);
        List<Path> outputs = new ArrayList<>();

        if (config.isEnabled(Feature.NSS_REPORT)) {
            if (config.isEnabled(Feature.WIND) && config.isEnabled(Feature.WAVE)) {
                outputs.add(reportWriter.writeNssReport(buildNssReport(dataset)));
            } else {
                log.warn("NSS report requested but it needs both wind and wave data, skipping.");
            }
        }

        if (config.isEnabled(Feature.SCATTER_REPORT)) {
            ScatterReport report = buildScatterReport(dataset, binTable);
            if (report.getSheets().isEmpty()) {
                log.warn("Scatter report requested but no scatter sheets apply to the enabled data, skipping.");
            } else {
                outputs.add(reportWriter.writeScatterReport(report));
            }
        }
        return outputs;
    }

    /**
     * 执行处理计划：校验全部步骤参数后依次运行各处理器
     *
     * @return 处理过程中发布的分箱表
     */
    public BinTable process(ObservationDataset dataset) {
        ProcessingPlan plan = ProcessingPlanFactory.fromConfig(config);
        ValidationResult validation = processorManager.validatePlan(plan);
        if (!validation.isValid()) {
            throw ReportException.configuration("Invalid processing plan: "
                    + String.join("; ", validation.getErrors()));
        }

        log.info("Processing dataset of {} rows with {} steps", dataset.size(), plan.size());
        BinTable binTable = new BinTable();
        for (StepConfig step : plan.getSteps()) {
            DatasetProcessor processor = processorManager.getProcessor(step.getProcessorId());
            processor.execute(new DefaultProcessingContext(dataset, binTable, config.getBinType(),
                    step.getParameters()));
        }
        return binTable;
    }

    NssReport buildNssReport(ObservationDataset dataset) {
        log.info("Calculating NSS tables");
        NssTabulator tabulator = new NssTabulator(config.getMethod());

        List<SeaState> seaStates = new ArrayList<>();
        seaStates.add(SeaState.TOTAL);
        if (config.isEnabled(Feature.WAVE_SPECTRAL)) {
            seaStates.add(SeaState.WIND_SEA);
            seaStates.add(SeaState.SWELL);
        }

        List<TableJob<NssTable>> jobs = new ArrayList<>();
        for (SeaState seaState : seaStates) {
            Set<String> required = new LinkedHashSet<>(Arrays.asList(
                    NssTabulator.SPEED_BIN_COLUMN, NssTabulator.WIND_SECTOR_COLUMN,
                    seaState.getWaveSectorColumn(), seaState.getHeightColumn(), seaState.getPeriodColumn()));
            jobs.add(new TableJob<>(seaState.getSheetName(), required, ds -> tabulator.tabulate(ds, seaState)));
        }

        List<NssTable> tables = tableExecutor.executeAll(jobs, dataset);
        Map<SeaState, NssTable> bySeaState = new EnumMap<>(SeaState.class);
        for (NssTable table : tables) {
            bySeaState.put(table.getSeaState(), table);
        }
        return new NssReport(config.getProject(), config.getBinType(), config.getHubHeight(), bySeaState);
    }

    ScatterReport buildScatterReport(ObservationDataset dataset, BinTable binTable) {
        log.info("Calculating scatter tables");
        List<ScatterSheet> sheets = new ScatterReportPlanner().plan(config, binTable);
        ScatterBuilder builder = new ScatterBuilder();

        List<TableJob<ScatterTable>> jobs = new ArrayList<>();
        for (ScatterSheet sheet : sheets) {
            List<List<ScatterRequest>> rows = sheet.getRows();
            for (int r = 0; r < rows.size(); r++) {
                for (int c = 0; c < rows.get(r).size(); c++) {
                    ScatterRequest request = rows.get(r).get(c);
                    Set<String> required = new LinkedHashSet<>();
                    required.add(request.getXVariable());
                    required.add(request.getYVariable());
                    for (ColumnFilter filter : request.getFilters()) {
                        required.add(filter.getColumn());
                    }
                    jobs.add(new TableJob<>(sheet.getName() + "[" + r + "," + c + "]", required,
                            ds -> builder.build(ds, request)));
                }
            }
        }

        List<ScatterTable> tables = tableExecutor.executeAll(jobs, dataset);
        ScatterReport report = new ScatterReport(config.getProject(), config.getBinType());
        int next = 0;
        for (ScatterSheet sheet : sheets) {
            List<List<ScatterTable>> rows = new ArrayList<>();
            for (List<ScatterRequest> requests : sheet.getRows()) {
                rows.add(new ArrayList<>(tables.subList(next, next + requests.size())));
                next += requests.size();
            }
            report.addSheet(sheet.getName(), rows);
        }
        log.info("Calculated {} scatter tables on {} sheets", report.tableCount(), sheets.size());
        return report;
    }

    @Override
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            log.warn("Environment is not running, ignoring shutdown.");
            return;
        }
        tableExecutor.shutdown();
        log.info("Report environment shut down.");
    }

    private void validateComponents() {
        if (processorManager == null) throw new IllegalStateException("ProcessorManager is required");
        if (tableExecutor == null) throw new IllegalStateException("TableExecutor is required");
        if (reportWriter == null) throw new IllegalStateException("ReportWriter is required");
    }

    public ReportConfig getConfig() { return config; }
    public ProcessorManager getProcessorManager() { return processorManager; }
    public TableExecutor getTableExecutor() { return tableExecutor; }
    public ReportWriter getReportWriter() { return reportWriter; }
    public boolean isRunning() { return running.get(); }
}
