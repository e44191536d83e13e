package com.metocean.report.writer;

import java.util.HashMap;
import java.util.Map;

/**
 * 离散列名到报表坐标轴标题的映射
 */
final class AxisTitles {

    private static final Map<String, String> TITLES = new HashMap<>();

    static {
        TITLES.put("WS_bins", "Wind Speed @ Hub Height, [m/s]");
        TITLES.put("WnD_sectors", "Wind Direction @ Hub Height, [degN]");
        TITLES.put("WS_10_bins", "Wind Speed @ 10m MSL, [m/s]");
        TITLES.put("WnD_10_sectors", "Wind Direction @ 10m MSL, [degN]");
        TITLES.put("Hs_bins", "Significant Wave Height (Totalsea), Hm0 [m]");
        TITLES.put("Tp_bins", "Peak Wave Period (Totalsea), Tp [s]");
        TITLES.put("Tz_bins", "Zero-Crossing Period (Totalsea), Tz [s]");
        TITLES.put("WvD_sectors", "Mean Wave Direction (Totalsea), [degN]");
        TITLES.put("Hs_W_bins", "Significant Wave Height (Windsea), Hm0 [m]");
        TITLES.put("Tp_W_bins", "Peak Wave Period (Windsea), Tp [s]");
        TITLES.put("Tz_W_bins", "Zero-Crossing Wave Period (Windsea), Tz [s]");
        TITLES.put("WvD_W_sectors", "Mean Wave Direction (Windsea), [degN]");
        TITLES.put("Hs_S_bins", "Significant Wave Height (Swell), Hm0 [m]");
        TITLES.put("Tp_S_bins", "Peak Wave Period (Swell), Tp [s]");
        TITLES.put("Tz_S_bins", "Zero-Crossing Wave Period (Swell), Tz [s]");
        TITLES.put("WvD_S_sectors", "Mean Wave Direction (Swell), [degN]");
        TITLES.put("SV_bins", "Current Surface Speed (Total), [m/s]");
        TITLES.put("DaV_bins", "Current Depth Averaged Speed (Total), [m/s]");
        TITLES.put("CD_sectors", "Mean Current Direction (Total), [degN, going]");
        TITLES.put("SV_Tid_bins", "Current Surface Speed (Tidal), [m/s]");
        TITLES.put("DaV_Tid_bins", "Current Depth Averaged Speed (Tidal), [m/s]");
        TITLES.put("CD_Tid_sectors", "Mean Current Direction (Tidal), [degN, going]");
        TITLES.put("SV_Res_bins", "Current Surface Speed (Residual), [m/s]");
        TITLES.put("DaV_Res_bins", "Current Depth Averaged Speed (Residual), [m/s]");
        TITLES.put("CD_Res_sectors", "Mean Current Direction (Residual), [degN, going]");
    }

    private AxisTitles() {}

    /** 未登记的列名原样返回 */
    static String of(String column) {
        return TITLES.getOrDefault(column, column);
    }
}
