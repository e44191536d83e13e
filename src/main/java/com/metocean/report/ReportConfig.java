package com.metocean.report;

import com.metocean.report.model.BinType;
import com.metocean.report.model.Feature;
import com.metocean.report.model.ReductionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * 报表配置类。
 * 从 .properties 文件加载，构造完成后不可变，在所有组件之间只读共享。
 */
public class ReportConfig {

    private static final Logger log = LoggerFactory.getLogger(ReportConfig.class);

    public static final String DEFAULT_CONFIG_PATH = "config/metocean.properties";

    // ---- 报表 ----
    private String project;
    private BinType binType = BinType.LEFT;
    private ReductionMethod method = ReductionMethod.MEDIAN;
    private Set<Feature> features = EnumSet.noneOf(Feature.class);
    private Path outputDir = Paths.get(".");
    private int workerParallelism = Runtime.getRuntime().availableProcessors();

    // ---- 风 ----
    private Path windFile;
    private double hubHeight = 150;
    private double windBinSize = 1.0;
    private int windSectors = 12;

    // ---- 波浪 ----
    private Path waveFile;
    private double waveHeightBinSize = 0.5;
    private double wavePeriodBinSize = 1.0;
    private int waveSectors = 12;
    private double swellGamma = 10;

    // ---- 海流 ----
    private Path currentFile;
    private double currentBinSize = 0.1;
    private int currentSectors = 12;

    // ---- 海水 ----
    private Path waterFile;

    private ReportConfig() {}

    /**
     * 从文件加载配置
     *
     * @throws ReportException 文件不存在或无法读取、必选项缺失、数值无法解析时抛出
     */
    public static ReportConfig load(String configPath) {
        Path path = Paths.get(configPath);
        if (!Files.isRegularFile(path)) {
            throw ReportException.configuration("Config file not found: " + configPath);
        }
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new ReportException(ReportException.ErrorKind.CONFIGURATION,
                    "Failed to read config file " + configPath + ": " + e.getMessage(), e);
        }
        ReportConfig config = fromProperties(props);
        log.info("Loaded config from {}: {}", configPath, config);
        return config;
    }

    public static ReportConfig fromProperties(Properties props) {
        ReportConfig config = new ReportConfig();

        config.project = props.getProperty("report.project", "").trim();
        if (config.project.isEmpty()) {
            throw ReportException.configuration("Required key 'report.project' is missing");
        }

        String binType = props.getProperty("report.bin.type", "left");
        config.binType = BinType.parse(binType);
        if (config.binType == null) {
            log.warn("Invalid report.bin.type '{}', falling back to 'left'", binType);
            config.binType = BinType.LEFT;
        }
        String method = props.getProperty("report.method", "median");
        config.method = ReductionMethod.parse(method);
        if (config.method == null) {
            log.warn("Invalid report.method '{}', falling back to 'median'", method);
            config.method = ReductionMethod.MEDIAN;
        }

        config.outputDir = Paths.get(props.getProperty("output.dir", "."));
        config.workerParallelism = parseInt(props, "worker.parallelism",
                Runtime.getRuntime().availableProcessors());

        EnumSet<Feature> features = EnumSet.noneOf(Feature.class);
        if (parseToggle(props, "report.nss", true)) features.add(Feature.NSS_REPORT);
        if (parseToggle(props, "report.scatter", true)) features.add(Feature.SCATTER_REPORT);

        if (parseToggle(props, "wind.enabled", false)) {
            features.add(Feature.WIND);
            if (parseToggle(props, "wind.10m", false)) features.add(Feature.WIND_10M);
            config.windFile = requiredPath(props, "wind.file");
        }
        config.hubHeight = parseDouble(props, "wind.hub.height", 150);
        config.windBinSize = parseDouble(props, "wind.bin.size", 1.0);
        config.windSectors = parseInt(props, "wind.sectors", 12);

        if (parseToggle(props, "wave.enabled", false)) {
            features.add(Feature.WAVE);
            if (parseToggle(props, "wave.spectral", false)) features.add(Feature.WAVE_SPECTRAL);
            if (parseToggle(props, "wave.peak.enhancement", false)) features.add(Feature.PEAK_ENHANCEMENT);
            if (parseToggle(props, "wave.derive.peak.enhancement", false)) {
                features.add(Feature.DERIVE_PEAK_ENHANCEMENT);
            }
            config.waveFile = requiredPath(props, "wave.file");
        }
        config.waveHeightBinSize = parseDouble(props, "wave.height.bin.size", 0.5);
        config.wavePeriodBinSize = parseDouble(props, "wave.period.bin.size", 1.0);
        config.waveSectors = parseInt(props, "wave.sectors", 12);
        config.swellGamma = parseDouble(props, "wave.swell.gamma", 10);

        if (parseToggle(props, "current.enabled", false)) {
            features.add(Feature.CURRENT);
            if (parseToggle(props, "current.components", false)) features.add(Feature.CURRENT_COMPONENTS);
            config.currentFile = requiredPath(props, "current.file");
        }
        config.currentBinSize = parseDouble(props, "current.bin.size", 0.1);
        config.currentSectors = parseInt(props, "current.sectors", 12);

        if (parseToggle(props, "water.enabled", false)) {
            features.add(Feature.WATER);
            config.waterFile = requiredPath(props, "water.file");
        }

        config.features = Collections.unmodifiableSet(features);
        return config;
    }

    private static Path requiredPath(Properties props, String key) {
        String value = props.getProperty(key, "").trim();
        if (value.isEmpty()) {
            throw ReportException.configuration("Required key '" + key + "' is missing");
        }
        return Paths.get(value);
    }

    private static boolean parseToggle(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "on":
            case "yes":
                return true;
            case "false":
            case "off":
            case "no":
                return false;
            default:
                throw ReportException.configuration("Key '" + key + "' expects a toggle (true/false/on/off/yes/no), got: "
                        + value);
        }
    }

    private static double parseDouble(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ReportException(ReportException.ErrorKind.CONFIGURATION,
                    "Key '" + key + "' expects a number, got: " + value, e);
        }
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ReportException(ReportException.ErrorKind.CONFIGURATION,
                    "Key '" + key + "' expects an integer, got: " + value, e);
        }
    }

    public boolean isEnabled(Feature feature) {
        return features.contains(feature);
    }

    /**
     * 是否需要由Hs/Tp推算谱峰升高因子：要求推算且输入中没有实测值
     */
    public boolean derivesPeakEnhancement() {
        return isEnabled(Feature.DERIVE_PEAK_ENHANCEMENT) && !isEnabled(Feature.PEAK_ENHANCEMENT);
    }

    // ---- Getters ----
    public String getProject() { return project; }
    public BinType getBinType() { return binType; }
    public ReductionMethod getMethod() { return method; }
    public Set<Feature> getFeatures() { return features; }
    public Path getOutputDir() { return outputDir; }
    public int getWorkerParallelism() { return workerParallelism; }
    public Path getWindFile() { return windFile; }
    public double getHubHeight() { return hubHeight; }
    public double getWindBinSize() { return windBinSize; }
    public int getWindSectors() { return windSectors; }
    public Path getWaveFile() { return waveFile; }
    public double getWaveHeightBinSize() { return waveHeightBinSize; }
    public double getWavePeriodBinSize() { return wavePeriodBinSize; }
    public int getWaveSectors() { return waveSectors; }
    public double getSwellGamma() { return swellGamma; }
    public Path getCurrentFile() { return currentFile; }
    public double getCurrentBinSize() { return currentBinSize; }
    public int getCurrentSectors() { return currentSectors; }
    public Path getWaterFile() { return waterFile; }

    @Override
    public String toString() {
        return "ReportConfig{project='" + project + "'"
                + ", binType=" + binType
                + ", method=" + method
                + ", features=" + features
                + ", parallelism=" + workerParallelism
                + ", outputDir='" + outputDir + "'}";
    }
}
