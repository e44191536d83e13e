package com.metocean.report.engine;

import com.metocean.report.ReportConfig;
import com.metocean.report.model.BinTable;
import com.metocean.report.model.ColumnFilter;
import com.metocean.report.model.Feature;
import com.metocean.report.model.ScatterRequest;
import com.metocean.report.model.ScatterSheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 散点报表规划：根据功能开关生成全部工作表及每张表的定义。
 * 表格请求中的变量名均为离散列名（"_bins" / "_sectors"）。
 */
public class ScatterReportPlanner {

    private static final Logger log = LoggerFactory.getLogger(ScatterReportPlanner.class);

    /**
     * 一种海况分解对应的列名组合
     */
    private static final class Sea {
        final String label;
        final String height;
        final String period;
        final String direction;

        Sea(String label, String height, String period, String direction) {
            this.label = label;
            this.height = height;
            this.period = period;
            this.direction = direction;
        }
    }

    /**
     * 一个测风高度对应的列名组合
     */
    private static final class Wind {
        final String label;
        final String speed;
        final String direction;

        Wind(String label, String speed, String direction) {
            this.label = label;
            this.speed = speed;
            this.direction = direction;
        }
    }

    private static final Sea TOTAL_SEA = new Sea("Totalsea", "Hs_bins", "Tp_bins", "WvD_sectors");
    private static final Sea SWELL = new Sea("Swell", "Hs_S_bins", "Tp_S_bins", "WvD_S_sectors");
    private static final Sea WIND_SEA = new Sea("Windsea", "Hs_W_bins", "Tp_W_bins", "WvD_W_sectors");

    private static final Wind HUB_HEIGHT = new Wind("@HH", "WS_bins", "WnD_sectors");
    private static final Wind TEN_METRES = new Wind("@10m", "WS_10_bins", "WnD_10_sectors");

    public List<ScatterSheet> plan(ReportConfig config, BinTable binTable) {
        boolean wind = config.isEnabled(Feature.WIND);
        boolean wave = config.isEnabled(Feature.WAVE);
        boolean tenMetres = wind && config.isEnabled(Feature.WIND_10M);

        List<Wind> heights = new ArrayList<>();
        if (wind) heights.add(HUB_HEIGHT);
        if (tenMetres) heights.add(TEN_METRES);

        List<Sea> seas = new ArrayList<>();
        if (wave) {
            seas.add(TOTAL_SEA);
            if (config.isEnabled(Feature.WAVE_SPECTRAL)) {
                seas.add(SWELL);
                seas.add(WIND_SEA);
            }
        }

        List<ScatterSheet> sheets = new ArrayList<>();

        for (Wind w : heights) {
            sheets.add(single("WndSpd-WndDir (" + w.label + ")", new ScatterRequest(w.direction, w.speed)));
        }

        if (wave) {
            List<ScatterRequest> row = new ArrayList<>();
            for (Sea sea : seas) {
                row.add(new ScatterRequest(sea.direction, sea.height));
            }
            sheets.add(new ScatterSheet("Hs-WaveDir", Collections.singletonList(row)));
        }

        if (wind && wave) {
            for (Wind w : heights) {
                List<ScatterRequest> row = new ArrayList<>();
                for (Sea sea : seas) {
                    row.add(new ScatterRequest(w.direction, sea.height));
                }
                sheets.add(new ScatterSheet("Hs-WindDir (" + w.label + ")", Collections.singletonList(row)));
            }
            for (Wind w : heights) {
                for (Sea sea : seas) {
                    sheets.add(new ScatterSheet("WndSpd (" + w.label + ")-Hs (" + sea.label + ")",
                            misalignmentGrid(config, sea.height, w.speed, w, sea)));
                }
            }
            for (Wind w : heights) {
                for (Sea sea : seas) {
                    sheets.add(new ScatterSheet("Hs-Tp (" + sea.label + ") (Wind " + w.label + ")",
                            misalignmentGrid(config, sea.period, sea.height, w, sea)));
                }
            }
            for (Wind w : heights) {
                List<ScatterRequest> row = new ArrayList<>();
                for (Sea sea : seas) {
                    row.add(new ScatterRequest(sea.direction, w.direction));
                }
                sheets.add(new ScatterSheet("WindDir-WaveDir (" + w.label + ")", Collections.singletonList(row)));

                List<List<ScatterRequest>> bySpeed = new ArrayList<>();
                for (double speedBin : binTable.centers(w.speed.replace("_bins", ""))) {
                    List<ScatterRequest> speedRow = new ArrayList<>();
                    for (Sea sea : seas) {
                        speedRow.add(new ScatterRequest(sea.direction, w.direction,
                                new ColumnFilter(w.speed, speedBin)));
                    }
                    bySpeed.add(speedRow);
                }
                String name = w == HUB_HEIGHT ? "WindDir-WaveDir by WndSpd (@HH)" : "WindDir-WaveDir by WndSpd(@10m)";
                sheets.add(new ScatterSheet(name, bySpeed));
            }
        }

        if (config.isEnabled(Feature.CURRENT)) {
            boolean components = config.isEnabled(Feature.CURRENT_COMPONENTS);
            sheets.add(currentSheet("Srfc CurrentSpd-CurrentDir", "SV", components));
            sheets.add(currentSheet("DpthAvg CurrentSpd-CurrentDir", "DaV", components));
        }

        int tables = 0;
        for (ScatterSheet sheet : sheets) {
            tables += sheet.tableCount();
        }
        log.info("Planned {} scatter sheets with {} tables", sheets.size(), tables);
        return sheets;
    }

    /**
     * 风浪方向错位网格：
     * 第0行全向表；第1行按浪向扇区；第2行按风向扇区；其后每个风向扇区一行，行内按浪向扇区。
     */
    private static List<List<ScatterRequest>> misalignmentGrid(ReportConfig config, String x, String y, Wind wind, Sea sea) {
        int windSectors = config.getWindSectors();
        int waveSectors = config.getWaveSectors();
        List<List<ScatterRequest>> rows = new ArrayList<>();

        rows.add(Collections.singletonList(new ScatterRequest(x, y)));

        List<ScatterRequest> byWave = new ArrayList<>();
        for (int v = 1; v <= waveSectors; v++) {
            byWave.add(new ScatterRequest(x, y, new ColumnFilter(sea.direction, v)));
        }
        rows.add(byWave);

        List<ScatterRequest> byWind = new ArrayList<>();
        for (int w = 1; w <= windSectors; w++) {
            byWind.add(new ScatterRequest(x, y, new ColumnFilter(wind.direction, w)));
        }
        rows.add(byWind);

        for (int w = 1; w <= windSectors; w++) {
            List<ScatterRequest> row = new ArrayList<>();
            for (int v = 1; v <= waveSectors; v++) {
                row.add(new ScatterRequest(x, y,
                        new ColumnFilter(wind.direction, w), new ColumnFilter(sea.direction, v)));
            }
            rows.add(row);
        }
        return rows;
    }

    private static ScatterSheet currentSheet(String name, String speed, boolean components) {
        List<ScatterRequest> row = new ArrayList<>();
        row.add(new ScatterRequest("CD_sectors", speed + "_bins"));
        if (components) {
            row.add(new ScatterRequest("CD_Tid_sectors", speed + "_Tid_bins"));
            row.add(new ScatterRequest("CD_Res_sectors", speed + "_Res_bins"));
        }
        return new ScatterSheet(name, Collections.singletonList(row));
    }

    private static ScatterSheet single(String name, ScatterRequest request) {
        return new ScatterSheet(name, Collections.singletonList(Collections.singletonList(request)));
    }
}
