package com.metocean.report.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.metocean.report.ReportConfig;
import org.junit.jupiter.api.Test;

import java.util.Properties;

class DataSourceTest {

    private static ReportConfig config(String... keyValues) {
        Properties props = new Properties();
        props.setProperty("report.project", "Test");
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return ReportConfig.fromProperties(props);
    }

    @Test
    void windColumnsWithTenMetreHeight() {
        ReportConfig config = config("wind.enabled", "true", "wind.file", "w.txt", "wind.10m", "true");

        assertThat(DataSource.WIND.columns(config))
                .containsExactly("WS", "WnD", "T", "Roh", "WS_10", "WnD_10", "T_10", "Roh_10");
    }

    @Test
    void spectralWaveWithMeasuredGamma() {
        ReportConfig config = config("wave.enabled", "true", "wave.file", "v.txt",
                "wave.spectral", "true", "wave.peak.enhancement", "true");

        assertThat(DataSource.WAVE.columns(config)).hasSize(15).containsSubsequence(
                "Hs", "WvD", "Tp", "Tz", "G", "Hs_W", "WvD_W", "Tp_W", "Tz_W", "G_W",
                "Hs_S", "WvD_S", "Tp_S", "Tz_S", "G_S");
    }

    @Test
    void plainWave() {
        ReportConfig config = config("wave.enabled", "true", "wave.file", "v.txt");

        assertThat(DataSource.WAVE.columns(config)).containsExactly("Hs", "WvD", "Tp", "Tz");
    }

    @Test
    void currentComponentsAndWater() {
        ReportConfig config = config("current.enabled", "true", "current.file", "c.txt",
                "current.components", "on");

        assertThat(DataSource.CURRENT.columns(config)).hasSize(9);
        assertThat(DataSource.WATER.columns(config)).containsExactly("Salt", "SST", "Roh_W");
        assertThat(DataSource.CURRENT.file(config).toString()).isEqualTo("c.txt");
    }
}
