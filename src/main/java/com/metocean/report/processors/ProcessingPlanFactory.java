package com.metocean.report.processors;

import com.metocean.report.ReportConfig;
import com.metocean.report.model.Feature;
import com.metocean.report.model.ProcessingPlan;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 由配置推导处理计划：先推算谱峰升高因子，再对连续变量分箱，最后对方向变量划分扇区。
 */
public final class ProcessingPlanFactory {

    private ProcessingPlanFactory() {}

    public static ProcessingPlan fromConfig(ReportConfig config) {
        ProcessingPlan plan = new ProcessingPlan();
        boolean wind = config.isEnabled(Feature.WIND);
        boolean tenMetres = wind && config.isEnabled(Feature.WIND_10M);
        boolean wave = config.isEnabled(Feature.WAVE);
        boolean spectral = wave && config.isEnabled(Feature.WAVE_SPECTRAL);
        boolean current = config.isEnabled(Feature.CURRENT);
        boolean components = current && config.isEnabled(Feature.CURRENT_COMPONENTS);

        // 1. 谱峰升高因子
        if (wave && config.derivesPeakEnhancement()) {
            derive(plan, "G", "Hs", "Tp");
            if (spectral) {
                derive(plan, "G_W", "Hs_W", "Tp_W");
                plan.addStep(PeakEnhancementProcessor.ID, params(
                        "mode", PeakEnhancementProcessor.MODE_CONSTANT,
                        "target", "G_S",
                        "value", config.getSwellGamma()));
            }
        }

        // 2. 分箱
        if (wind) {
            bin(plan, "WS", config.getWindBinSize());
            if (tenMetres) {
                bin(plan, "WS_10", config.getWindBinSize());
            }
        }
        if (wave) {
            for (String suffix : spectral ? new String[] {"", "_W", "_S"} : new String[] {""}) {
                bin(plan, "Hs" + suffix, config.getWaveHeightBinSize());
                bin(plan, "Tp" + suffix, config.getWavePeriodBinSize());
                bin(plan, "Tz" + suffix, config.getWavePeriodBinSize());
            }
        }
        if (current) {
            for (String suffix : components ? new String[] {"", "_Tid", "_Res"} : new String[] {""}) {
                bin(plan, "SV" + suffix, config.getCurrentBinSize());
                bin(plan, "DaV" + suffix, config.getCurrentBinSize());
            }
        }

        // 3. 扇区
        if (wind) {
            sectorise(plan, "WnD", config.getWindSectors());
            if (tenMetres) {
                sectorise(plan, "WnD_10", config.getWindSectors());
            }
        }
        if (wave) {
            for (String suffix : spectral ? new String[] {"", "_W", "_S"} : new String[] {""}) {
                sectorise(plan, "WvD" + suffix, config.getWaveSectors());
            }
        }
        if (current) {
            for (String suffix : components ? new String[] {"", "_Tid", "_Res"} : new String[] {""}) {
                sectorise(plan, "CD" + suffix, config.getCurrentSectors());
            }
        }
        return plan;
    }

    private static void derive(ProcessingPlan plan, String target, String height, String period) {
        plan.addStep(PeakEnhancementProcessor.ID, params(
                "mode", PeakEnhancementProcessor.MODE_DERIVE,
                "target", target,
                "height", height,
                "period", period));
    }

    private static void bin(ProcessingPlan plan, String column, double width) {
        plan.addStep(BinningProcessor.ID, params("column", column, "width", width));
    }

    private static void sectorise(ProcessingPlan plan, String column, int sectors) {
        plan.addStep(SectorisingProcessor.ID, params("column", column, "sectors", sectors));
    }

    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
