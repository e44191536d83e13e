package com.metocean.report.core.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.metocean.report.MetoceanReportApplication;
import com.metocean.report.ReportConfig;
import com.metocean.report.ReportException;
import com.metocean.report.TestDatasets;
import com.metocean.report.core.ReportWriter;
import com.metocean.report.model.BinTable;
import com.metocean.report.model.NssReport;
import com.metocean.report.model.NssTable;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.ScatterReport;
import com.metocean.report.model.ScatterTable;
import com.metocean.report.model.SeaState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

@ExtendWith(MockitoExtension.class)
class DefaultReportEnvironmentTest {

    @Mock
    private ReportWriter reportWriter;

    private DefaultReportEnvironment environment;

    @AfterEach
    void tearDown() {
        if (environment != null && environment.isRunning()) {
            environment.shutdown();
        }
    }

    private static Properties windAndWave() {
        Properties props = new Properties();
        props.setProperty("report.project", "Site");
        props.setProperty("report.method", "mean");
        props.setProperty("worker.parallelism", "2");
        props.setProperty("wind.enabled", "true");
        props.setProperty("wind.file", "wind.txt");
        props.setProperty("wind.sectors", "4");
        props.setProperty("wave.enabled", "true");
        props.setProperty("wave.file", "wave.txt");
        props.setProperty("wave.sectors", "4");
        props.setProperty("wave.derive.peak.enhancement", "true");
        return props;
    }

    /**
     * 风速 [2.5, 2.5, 7.5, 7.5]，风向 [0, 10, 90, 100]，Hs = [1, 2, 3, 4]
     */
    private static ObservationDataset windAndWaveData() {
        ObservationDataset dataset = TestDatasets.hourly(4);
        dataset.addColumn("WS", new double[] {2.5, 2.5, 7.5, 7.5});
        dataset.addColumn("WnD", new double[] {0, 10, 90, 100});
        dataset.addColumn("T", new double[] {10, 10, 10, 10});
        dataset.addColumn("Roh", new double[] {1.22, 1.22, 1.22, 1.22});
        dataset.addColumn("Hs", new double[] {1, 2, 3, 4});
        dataset.addColumn("WvD", new double[] {180, 180, 180, 180});
        dataset.addColumn("Tp", new double[] {2, 2, 3, 3});
        dataset.addColumn("Tz", new double[] {4, 5, 6, 7});
        return dataset;
    }

    private DefaultReportEnvironment start(ReportConfig config) {
        DefaultProcessorManager processorManager = new DefaultProcessorManager();
        MetoceanReportApplication.registerBuiltinProcessors(processorManager);
        environment = DefaultReportEnvironment.initialize(config)
                .setProcessorManager(processorManager)
                .setTableExecutor(new DefaultTableExecutor(config.getWorkerParallelism()))
                .setReportWriter(reportWriter);
        environment.start();
        return environment;
    }

    @Test
    void writesBothWorkbooks() {
        Path nssPath = Paths.get("nss.xlsx");
        Path scatterPath = Paths.get("scatter.xlsx");
        when(reportWriter.writeNssReport(any())).thenReturn(nssPath);
        when(reportWriter.writeScatterReport(any())).thenReturn(scatterPath);

        List<Path> outputs = start(ReportConfig.fromProperties(windAndWave())).run(windAndWaveData());

        assertThat(outputs).containsExactly(nssPath, scatterPath);

        ArgumentCaptor<NssReport> nss = ArgumentCaptor.forClass(NssReport.class);
        verify(reportWriter).writeNssReport(nss.capture());
        assertThat(nss.getValue().getProject()).isEqualTo("Site");
        assertThat(nss.getValue().getTables()).containsOnlyKeys(SeaState.TOTAL);
        NssTable total = nss.getValue().getTable(SeaState.TOTAL);
        assertThat(total.getSpeedAxis().size()).isEqualTo(8);
        assertThat(total.get(0, 0, 2, NssTable.HS)).isCloseTo(1.5, within(1e-12));
        assertThat(total.get(0, 0, 7, NssTable.HS)).isCloseTo(3.5, within(1e-12));
        assertThat(total.get(0, 0, 7, NssTable.GAMMA)).isCloseTo(5.0, within(1e-12));
        assertThat(total.probabilitySum(0, 0)).isCloseTo(1.0, within(1e-12));

        ArgumentCaptor<ScatterReport> scatter = ArgumentCaptor.forClass(ScatterReport.class);
        verify(reportWriter).writeScatterReport(scatter.capture());
        assertThat(scatter.getValue().getSheets().keySet()).containsExactly(
                "WndSpd-WndDir (@HH)",
                "Hs-WaveDir",
                "Hs-WindDir (@HH)",
                "WndSpd (@HH)-Hs (Totalsea)",
                "Hs-Tp (Totalsea) (Wind @HH)",
                "WindDir-WaveDir (@HH)",
                "WindDir-WaveDir by WndSpd (@HH)");
        ScatterTable windRose = scatter.getValue().getSheets().get("WndSpd-WndDir (@HH)").get(0).get(0);
        assertThat(windRose.total()).isCloseTo(1.0, within(1e-12));
        assertThat(windRose.get(2, 0)).isCloseTo(0.5, within(1e-12));
        assertThat(scatter.getValue().getSheets().get("WindDir-WaveDir by WndSpd (@HH)")).hasSize(8);
    }

    @Test
    void spectralRunBuildsThreeNssTables() {
        Properties props = windAndWave();
        props.setProperty("wave.spectral", "true");
        when(reportWriter.writeNssReport(any())).thenReturn(Paths.get("nss.xlsx"));
        when(reportWriter.writeScatterReport(any())).thenReturn(Paths.get("scatter.xlsx"));

        ObservationDataset dataset = windAndWaveData();
        dataset.addColumn("Hs_W", new double[] {1, 2, 3, 4});
        dataset.addColumn("WvD_W", new double[] {180, 180, 270, 270});
        dataset.addColumn("Tp_W", new double[] {2, 2, 3, 3});
        dataset.addColumn("Tz_W", new double[] {2, 2, 3, 3});
        dataset.addColumn("Hs_S", new double[] {0.5, 0.5, 1, 1});
        dataset.addColumn("WvD_S", new double[] {0, 0, 0, 0});
        dataset.addColumn("Tp_S", new double[] {10, 10, 12, 12});
        dataset.addColumn("Tz_S", new double[] {8, 8, 9, 9});

        start(ReportConfig.fromProperties(props)).run(dataset);

        ArgumentCaptor<NssReport> nss = ArgumentCaptor.forClass(NssReport.class);
        verify(reportWriter).writeNssReport(nss.capture());
        assertThat(nss.getValue().getTables())
                .containsOnlyKeys(SeaState.TOTAL, SeaState.WIND_SEA, SeaState.SWELL);

        NssTable windSea = nss.getValue().getTable(SeaState.WIND_SEA);
        assertThat(windSea.getWindRowCount()).isEqualTo(5);
        assertThat(windSea.get(2, 4, 7, NssTable.HS)).isCloseTo(3.5, within(1e-12));
        assertThat(windSea.get(2, 4, 7, NssTable.PROBABILITY)).isCloseTo(0.5, within(1e-12));
        assertThat(windSea.get(2, 4, 7, NssTable.GAMMA)).isCloseTo(5.0, within(1e-12));

        NssTable swell = nss.getValue().getTable(SeaState.SWELL);
        assertThat(swell.getWindRowCount()).isEqualTo(1);
        assertThat(swell.get(0, 1, 7, NssTable.GAMMA)).isCloseTo(10.0, within(1e-12));
        assertThat(swell.get(0, 1, 2, NssTable.PROBABILITY)).isCloseTo(0.5, within(1e-12));
        assertThat(swell.probabilitySum(0, 0)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void nssNeedsWaves() {
        Properties props = windAndWave();
        props.setProperty("wave.enabled", "false");
        when(reportWriter.writeScatterReport(any())).thenReturn(Paths.get("scatter.xlsx"));
        ObservationDataset dataset = TestDatasets.hourly(2);
        dataset.addColumn("WS", new double[] {3, 4});
        dataset.addColumn("WnD", new double[] {45, 270});

        List<Path> outputs = start(ReportConfig.fromProperties(props)).run(dataset);

        assertThat(outputs).hasSize(1);
        verify(reportWriter, never()).writeNssReport(any());
    }

    @Test
    void processPublishesBinsAndAppendsColumns() {
        ObservationDataset dataset = windAndWaveData();

        BinTable binTable = start(ReportConfig.fromProperties(windAndWave())).process(dataset);

        assertThat(binTable.asMap().keySet()).containsExactly("WS", "Hs", "Tp", "Tz");
        assertThat(dataset.getDiscreteColumnNames()).contains("WS_bins", "WnD_sectors", "WvD_sectors");
        assertThat(dataset.hasColumn("G")).isTrue();
    }

    @Test
    void invalidPlanIsConfigurationError() {
        Properties props = windAndWave();
        props.setProperty("wind.bin.size", "0");

        assertThatThrownBy(() -> start(ReportConfig.fromProperties(props)).run(windAndWaveData()))
                .isInstanceOfSatisfying(ReportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ReportException.ErrorKind.CONFIGURATION))
                .hasMessageContaining("width");
    }

    @Test
    void emptyDatasetIsRejected() {
        DefaultReportEnvironment env = start(ReportConfig.fromProperties(windAndWave()));

        assertThatThrownBy(() -> env.run(TestDatasets.hourly(0)))
                .isInstanceOfSatisfying(ReportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ReportException.ErrorKind.PRECONDITION));
    }

    @Test
    void runRequiresStart() {
        environment = DefaultReportEnvironment.initialize(ReportConfig.fromProperties(windAndWave()));

        assertThatThrownBy(() -> environment.run(windAndWaveData())).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> environment.start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ProcessorManager");
    }
}
