package com.metocean.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

class MetoceanReportApplicationTest {

    @TempDir
    Path dir;

    private Path writeData() throws IOException {
        List<String> wind = new ArrayList<>();
        List<String> wave = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            String time = String.format("20210601\t%02d00", hour);
            wind.add(time + "\t" + (4 + hour % 7) + "\t" + (hour * 15) + "\t12\t1.22");
            wave.add(time + "\t" + (0.8 + 0.1 * (hour % 5)) + "\t" + ((hour * 40) % 360)
                    + "\t" + (5 + hour % 4) + "\t" + (4 + hour % 3));
        }
        Files.write(dir.resolve("wind.txt"), wind, StandardCharsets.UTF_8);
        Files.write(dir.resolve("wave.txt"), wave, StandardCharsets.UTF_8);
        return dir;
    }

    private ReportConfig config() {
        Properties props = new Properties();
        props.setProperty("report.project", "Pilot");
        props.setProperty("output.dir", dir.resolve("reports").toString());
        props.setProperty("worker.parallelism", "2");
        props.setProperty("wind.enabled", "true");
        props.setProperty("wind.file", dir.resolve("wind.txt").toString());
        props.setProperty("wind.sectors", "8");
        props.setProperty("wave.enabled", "true");
        props.setProperty("wave.file", dir.resolve("wave.txt").toString());
        props.setProperty("wave.sectors", "8");
        props.setProperty("wave.derive.peak.enhancement", "true");
        return ReportConfig.fromProperties(props);
    }

    @Test
    void producesBothWorkbooks() throws IOException {
        writeData();

        List<Path> outputs = new MetoceanReportApplication().run(config());

        assertThat(outputs).containsExactly(
                dir.resolve("reports").resolve("Pilot_Metocean_NSS_Tables.xlsx"),
                dir.resolve("reports").resolve("Pilot_Metocean_Scatter_Tables.xlsx"));
        try (InputStream in = Files.newInputStream(outputs.get(1));
             XSSFWorkbook workBook = new XSSFWorkbook(in)) {
            assertThat(workBook.getNumberOfSheets()).isEqualTo(7);
            assertThat(workBook.getSheetName(0)).isEqualTo("WndSpd-WndDir (@HH)");
        }
        try (InputStream in = Files.newInputStream(outputs.get(0));
             XSSFWorkbook workBook = new XSSFWorkbook(in)) {
            assertThat(workBook.getSheetName(0)).isEqualTo("NSS Total sea");
        }
    }

    @Test
    void schemaErrorStopsTheRun() throws IOException {
        writeData();
        Files.write(dir.resolve("wave.txt"), List.of("20210601\t0000\t1.0\t90\t6"), StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new MetoceanReportApplication().run(config()))
                .isInstanceOfSatisfying(ReportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ReportException.ErrorKind.SCHEMA));
        assertThat(Files.exists(dir.resolve("reports"))).isFalse();
    }
}
