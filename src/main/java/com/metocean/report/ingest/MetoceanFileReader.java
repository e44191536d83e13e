package com.metocean.report.ingest;

import com.metocean.report.ReportConfig;
import com.metocean.report.ReportException;
import com.metocean.report.model.ObservationDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 读取制表符分隔的风、浪、流、海水数据文件，
 * 校验列数、建立时间索引，并按时间戳内连接为一个观测数据集。
 */
public class MetoceanFileReader {

    private static final Logger log = LoggerFactory.getLogger(MetoceanFileReader.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    /**
     * 读取配置中所有启用的数据源
     *
     * @throws ReportException 没有启用的数据源、文件无法读取或格式不符时抛出
     */
    public ObservationDataset read(ReportConfig config) {
        log.info("Parsing data...");
        List<SourceTable> tables = new ArrayList<>();
        for (DataSource source : DataSource.values()) {
            if (config.isEnabled(source.getFeature())) {
                tables.add(readSource(source.file(config), source.getLabel(), source.columns(config)));
            }
        }
        if (tables.isEmpty()) {
            throw ReportException.configuration("No data source is enabled, nothing to read");
        }
        ObservationDataset dataset = join(tables);
        log.info("Parsing data complete: {} synchronised rows", dataset.size());
        return dataset;
    }

    /**
     * 读取单个数据文件
     *
     * @param file    文件路径
     * @param label   数据源名称，用于错误信息
     * @param columns 日期、时间之后的列名
     */
    SourceTable readSource(Path file, String label, List<String> columns) {
        int expected = columns.size() + DataSource.TIME_COLUMNS;
        SourceTable table = new SourceTable(columns);
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] fields = line.split("\t", -1);
                if (fields.length != expected) {
                    throw ReportException.schema("Incorrect number of fields in the " + label + " data file "
                            + file + " at line " + lineNumber + ": expected " + expected + ", got " + fields.length
                            + ". Check the data file or the config file");
                }
                LocalDateTime timestamp = parseTimestamp(fields[0].trim(), fields[1].trim(), file, lineNumber);
                double[] values = new double[columns.size()];
                for (int c = 0; c < values.length; c++) {
                    values[c] = parseValue(fields[c + DataSource.TIME_COLUMNS].trim(), file, lineNumber);
                }
                if (table.rows.put(timestamp, values) != null) {
                    throw ReportException.precondition("Duplicate timestamp " + timestamp + " in the " + label
                            + " data file " + file);
                }
            }
        } catch (IOException e) {
            throw new ReportException(ReportException.ErrorKind.CONFIGURATION,
                    "Failed to read " + label + " data file " + file + ": " + e.getMessage(), e);
        }
        log.debug("Read {} rows from {} data file {}", table.rows.size(), label, file);
        return table;
    }

    static LocalDateTime parseTimestamp(String date, String time, Path file, int lineNumber) {
        try {
            LocalDate day = LocalDate.parse(date, DATE_FORMAT);
            int hhmm = Integer.parseInt(time);
            int hours = hhmm / 100;
            int minutes = hhmm % 100;
            if (hhmm < 0 || hours > 23 || minutes > 59) {
                throw ReportException.schema("Invalid time '" + time + "' in " + file + " at line " + lineNumber);
            }
            return day.atTime(hours, minutes);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new ReportException(ReportException.ErrorKind.SCHEMA,
                    "Invalid date/time '" + date + " " + time + "' in " + file + " at line " + lineNumber, e);
        }
    }

    static double parseValue(String field, Path file, int lineNumber) {
        if (field.isEmpty() || field.equalsIgnoreCase("NaN")) {
            return Double.NaN;
        }
        double value;
        try {
            value = Double.parseDouble(field);
        } catch (NumberFormatException e) {
            throw new ReportException(ReportException.ErrorKind.SCHEMA,
                    "Unparseable number '" + field + "' in " + file + " at line " + lineNumber, e);
        }
        // 无穷值无法分箱
        if (Double.isInfinite(value)) {
            throw ReportException.schema("Non-finite number '" + field + "' in " + file + " at line " + lineNumber);
        }
        return value;
    }

    /**
     * 按时间戳内连接，只保留所有数据源共有的时刻，结果按时间排序
     */
    static ObservationDataset join(List<SourceTable> tables) {
        Set<LocalDateTime> common = new TreeSet<>(tables.get(0).rows.keySet());
        for (int i = 1; i < tables.size(); i++) {
            common.retainAll(tables.get(i).rows.keySet());
        }

        List<LocalDateTime> timestamps = new ArrayList<>(common);
        ObservationDataset dataset = new ObservationDataset(timestamps);
        for (SourceTable table : tables) {
            for (int c = 0; c < table.columns.size(); c++) {
                double[] values = new double[timestamps.size()];
                for (int row = 0; row < values.length; row++) {
                    values[row] = table.rows.get(timestamps.get(row))[c];
                }
                dataset.addColumn(table.columns.get(c), values);
            }
        }
        return dataset;
    }

    /**
     * 单个数据文件的内容：时间戳 -> 各列数值
     */
    static class SourceTable {
        final List<String> columns;
        final Map<LocalDateTime, double[]> rows = new TreeMap<>();

        SourceTable(List<String> columns) {
            this.columns = columns;
        }
    }
}
