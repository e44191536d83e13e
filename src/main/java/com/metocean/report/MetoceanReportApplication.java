package com.metocean.report;

import com.metocean.report.core.impl.DefaultProcessorManager;
import com.metocean.report.core.impl.DefaultReportEnvironment;
import com.metocean.report.core.impl.DefaultTableExecutor;
import com.metocean.report.ingest.MetoceanFileReader;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.processors.BinningProcessor;
import com.metocean.report.processors.PeakEnhancementProcessor;
import com.metocean.report.processors.SectorisingProcessor;
import com.metocean.report.writer.XlsxReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * 系统启动引导类。
 * 一条命令完成一次报表运行：加载配置、读取数据、注册处理器、生成NSS表和散点表。
 *
 * 用法：java -jar metocean-report.jar [配置文件路径]
 */
public class MetoceanReportApplication {

    private static final Logger log = LoggerFactory.getLogger(MetoceanReportApplication.class);

    private DefaultReportEnvironment environment;

    public List<Path> run(ReportConfig config) {
        log.info("=== Metocean NSS & Scatter Report ===");
        log.info("Starting with config: {}", config);

        // 1. 读取并对齐各数据源
        ObservationDataset dataset = new MetoceanFileReader().read(config);

        // 2. 初始化处理器管理器并注册预置处理器
        DefaultProcessorManager processorManager = new DefaultProcessorManager();
        registerBuiltinProcessors(processorManager);

        // 3. 组装并启动运行时环境
        environment = DefaultReportEnvironment.initialize(config);
        environment.setProcessorManager(processorManager)
                .setTableExecutor(new DefaultTableExecutor(config.getWorkerParallelism()))
                .setReportWriter(new XlsxReportWriter(config.getOutputDir()));
        environment.start();

        try {
            List<Path> outputs = environment.run(dataset);
            log.info("=== Report finished, {} workbook(s) written ===", outputs.size());
            return outputs;
        } finally {
            shutdown();
        }
    }

    public void shutdown() {
        if (environment != null && environment.isRunning()) {
            environment.shutdown();
        }
    }

    /**
     * 注册系统预置的三类处理器
     */
    public static void registerBuiltinProcessors(DefaultProcessorManager processorManager) {
        processorManager.registerProcessor(BinningProcessor.ID, new BinningProcessor());
        processorManager.registerProcessor(SectorisingProcessor.ID, new SectorisingProcessor());
        processorManager.registerProcessor(PeakEnhancementProcessor.ID, new PeakEnhancementProcessor());

        log.info("Registered {} built-in processors.", processorManager.getAllProcessors().size());
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : ReportConfig.DEFAULT_CONFIG_PATH;

        try {
            ReportConfig config = ReportConfig.load(configPath);
            new MetoceanReportApplication().run(config);
        } catch (ReportException e) {
            log.error("Report failed [{}]: {}", e.getKind(), e.getMessage(), e);
            System.exit(1);
        }
    }
}
