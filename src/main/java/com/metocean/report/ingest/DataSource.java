package com.metocean.report.ingest;

import com.metocean.report.ReportConfig;
import com.metocean.report.model.Feature;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 输入数据源及其列布局。
 * 每个文件前两列为日期 (yyyyMMdd) 和时间 (HHmm)，其后的列由配置决定。
 */
public enum DataSource {
    WIND("wind", Feature.WIND),
    WAVE("wave", Feature.WAVE),
    CURRENT("current", Feature.CURRENT),
    WATER("water", Feature.WATER);

    /** 日期、时间两列 */
    public static final int TIME_COLUMNS = 2;

    private final String label;
    private final Feature feature;

    DataSource(String label, Feature feature) {
        this.label = label;
        this.feature = feature;
    }

    public String getLabel() { return label; }
    public Feature getFeature() { return feature; }

    public Path file(ReportConfig config) {
        switch (this) {
            case WIND:
                return config.getWindFile();
            case WAVE:
                return config.getWaveFile();
            case CURRENT:
                return config.getCurrentFile();
            default:
                return config.getWaterFile();
        }
    }

    /**
     * 日期、时间之后的数据列名
     */
    public List<String> columns(ReportConfig config) {
        List<String> columns = new ArrayList<>();
        switch (this) {
            case WIND:
                columns.addAll(Arrays.asList("WS", "WnD", "T", "Roh"));
                if (config.isEnabled(Feature.WIND_10M)) {
                    columns.addAll(Arrays.asList("WS_10", "WnD_10", "T_10", "Roh_10"));
                }
                break;
            case WAVE:
                boolean gamma = config.isEnabled(Feature.PEAK_ENHANCEMENT);
                for (String suffix : config.isEnabled(Feature.WAVE_SPECTRAL)
                        ? new String[] {"", "_W", "_S"} : new String[] {""}) {
                    columns.addAll(Arrays.asList("Hs" + suffix, "WvD" + suffix, "Tp" + suffix, "Tz" + suffix));
                    if (gamma) {
                        columns.add("G" + suffix);
                    }
                }
                break;
            case CURRENT:
                columns.addAll(Arrays.asList("SV", "DaV", "CD"));
                if (config.isEnabled(Feature.CURRENT_COMPONENTS)) {
                    columns.addAll(Arrays.asList("SV_Tid", "DaV_Tid", "CD_Tid", "SV_Res", "DaV_Res", "CD_Res"));
                }
                break;
            default:
                columns.addAll(Arrays.asList("Salt", "SST", "Roh_W"));
        }
        return columns;
    }
}
