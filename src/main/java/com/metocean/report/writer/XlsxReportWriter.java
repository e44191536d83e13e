package com.metocean.report.writer;

import com.metocean.report.ReportException;
import com.metocean.report.core.ReportWriter;
import com.metocean.report.model.BinAxis;
import com.metocean.report.model.BinType;
import com.metocean.report.model.ColumnFilter;
import com.metocean.report.model.DiscreteAxis;
import com.metocean.report.model.NssReport;
import com.metocean.report.model.NssTable;
import com.metocean.report.model.ScatterReport;
import com.metocean.report.model.ScatterRequest;
import com.metocean.report.model.ScatterTable;
import com.metocean.report.model.SeaState;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 基于Apache POI (XSSF) 的报表输出实现。
 *
 * NSS工作表按 全向-全向、风向-全向、全向-浪向、风向-浪向 四组依次排列，
 * 每组左侧为风速分箱索引，右侧为各扇区组合的表格。
 * 散点工作表按行排列表格，每张表带上下界、行列合计和总计。
 */
public class XlsxReportWriter implements ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(XlsxReportWriter.class);

    public static final String NSS_FILE_SUFFIX = "_Metocean_NSS_Tables.xlsx";
    public static final String SCATTER_FILE_SUFFIX = "_Metocean_Scatter_Tables.xlsx";

    static final String[] NSS_HEADERS = {"Hs [m]", "Tp [s]", "γ [-]", "Prob [%]"};
    static final String NAN_TEXT = "NaN";

    /** NSS表格左上角位置 */
    private static final int NSS_ORIGIN = 1;
    /** 每张NSS表的标题行数：表号、风向扇区、浪向扇区 */
    private static final int NSS_TITLE_ROWS = 3;

    private final Path outputDir;

    public XlsxReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Path writeNssReport(NssReport report) {
        Path file = outputDir.resolve(report.getProject() + NSS_FILE_SUFFIX);
        try (XSSFWorkbook workBook = new XSSFWorkbook()) {
            ReportStyles styles = new ReportStyles(workBook);
            for (Map.Entry<SeaState, NssTable> entry : report.getTables().entrySet()) {
                XSSFSheet sheet = workBook.createSheet(entry.getKey().getSheetName());
                sheet.setDisplayGridlines(false);
                writeNssSheet(sheet, entry.getValue(), report, styles);
            }
            save(workBook, file);
        } catch (IOException e) {
            throw new ReportException(ReportException.ErrorKind.COMPUTATION,
                    "Failed to write NSS report " + file + ": " + e.getMessage(), e);
        }
        log.info("NSS report written to {}", file);
        return file;
    }

    @Override
    public Path writeScatterReport(ScatterReport report) {
        Path file = outputDir.resolve(report.getProject() + SCATTER_FILE_SUFFIX);
        try (XSSFWorkbook workBook = new XSSFWorkbook()) {
            ReportStyles styles = new ReportStyles(workBook);
            for (Map.Entry<String, List<List<ScatterTable>>> entry : report.getSheets().entrySet()) {
                XSSFSheet sheet = workBook.createSheet(WorkbookUtil.createSafeSheetName(entry.getKey()));
                sheet.setDisplayGridlines(false);
                int row = 1;
                for (List<ScatterTable> tables : entry.getValue()) {
                    int col = 1;
                    int tallest = 0;
                    for (ScatterTable table : tables) {
                        writeScatterTable(sheet, table, row, col, report.getBinType(), styles);
                        col += 5 + table.columns();
                        tallest = Math.max(tallest, table.rows());
                    }
                    row += 6 + tallest;
                }
            }
            save(workBook, file);
        } catch (IOException e) {
            throw new ReportException(ReportException.ErrorKind.COMPUTATION,
                    "Failed to write scatter report " + file + ": " + e.getMessage(), e);
        }
        log.info("Scatter report written to {} ({} tables)", file, report.tableCount());
        return file;
    }

    private void save(XSSFWorkbook workBook, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (OutputStream out = Files.newOutputStream(file)) {
            workBook.write(out);
        }
    }

    // ---- NSS ----

    private void writeNssSheet(XSSFSheet sheet, NssTable table, NssReport report, ReportStyles styles) {
        int number = table.getSeaState().getTableNumber();
        int bins = table.getSpeedAxis().size();
        int blockHeight = NSS_TITLE_ROWS + bins + 4;
        int row = NSS_ORIGIN;

        // 全向-全向
        writeSpeedIndex(sheet, row, table.getSpeedAxis(), report, styles);
        writeNssBlock(sheet, row, NSS_ORIGIN + 3, table.slice(0, 0),
                new String[] {"Table " + number + ".0.0", "OMNI", "OMNI"}, styles);
        row += blockHeight;

        // 风向-全向
        if (table.getWindRowCount() > 1) {
            writeSpeedIndex(sheet, row, table.getSpeedAxis(), report, styles);
            int col = NSS_ORIGIN + 3;
            for (int w = 1; w < table.getWindRowCount(); w++) {
                writeNssBlock(sheet, row, col, table.slice(w, 0),
                        new String[] {"Table " + number + "." + w + ".0", String.valueOf(w), "OMNI"}, styles);
                col += NSS_HEADERS.length;
            }
            row += blockHeight;
        }

        // 全向-浪向
        writeSpeedIndex(sheet, row, table.getSpeedAxis(), report, styles);
        int col = NSS_ORIGIN + 3;
        for (int v = 1; v <= table.getWaveSectors(); v++) {
            writeNssBlock(sheet, row, col, table.slice(0, v),
                    new String[] {"Table " + number + ".0." + v, "OMNI", String.valueOf(v)}, styles);
            col += NSS_HEADERS.length;
        }

        // 风向-浪向
        for (int w = 1; w < table.getWindRowCount(); w++) {
            row += blockHeight;
            writeSpeedIndex(sheet, row, table.getSpeedAxis(), report, styles);
            col = NSS_ORIGIN + 3;
            for (int v = 1; v <= table.getWaveSectors(); v++) {
                writeNssBlock(sheet, row, col, table.slice(w, v),
                        new String[] {"Table " + number + "." + w + "." + v, String.valueOf(w), String.valueOf(v)},
                        styles);
                col += NSS_HEADERS.length;
            }
        }
    }

    /**
     * 风速分箱索引：Lower / Middle / Upper 三列，末行为SUM标签
     */
    private void writeSpeedIndex(XSSFSheet sheet, int row, BinAxis axis, NssReport report, ReportStyles styles) {
        int col = NSS_ORIGIN;
        BinType binType = report.getBinType();
        String[] titles = {
                "Hourly Mean WS at " + formatNumber(report.getHubHeight()) + "mMSL [m/s]", "Wind Sector", "Wave Sector"};
        XSSFCellStyle[] titleStyles = {styles.header, styles.windHeader, styles.waveHeader};
        for (int t = 0; t < titles.length; t++) {
            setText(sheet, row + t, col, titles[t], titleStyles[t]);
            ReportStyles.merge(sheet, new CellRangeAddress(row + t, row + t, col, col + 2), BorderStyle.THIN);
        }
        int headerRow = row + NSS_TITLE_ROWS;
        setText(sheet, headerRow, col, binType.getLowerHeader(), styles.header);
        setText(sheet, headerRow, col + 1, "Middle", styles.header);
        setText(sheet, headerRow, col + 2, binType.getUpperHeader(), styles.header);
        for (int b = 0; b < axis.size(); b++) {
            int r = headerRow + 1 + b;
            setNumber(sheet, r, col, axis.lowerBound(b), styles.index);
            setNumber(sheet, r, col + 1, axis.label(b), styles.index);
            setNumber(sheet, r, col + 2, axis.upperBound(b), styles.index);
        }
        int sumRow = headerRow + 1 + axis.size();
        setText(sheet, sumRow, col, "SUM", styles.index);
        ReportStyles.merge(sheet, new CellRangeAddress(sumRow, sumRow, col, col + 2), BorderStyle.THIN);
        sheet.setColumnWidth(col, 12 * 256);
        sheet.setColumnWidth(col + 2, 12 * 256);
    }

    private void writeNssBlock(XSSFSheet sheet, int row, int col, double[][] values, String[] titles,
                               ReportStyles styles) {
        int lastCol = col + NSS_HEADERS.length - 1;
        for (int t = 0; t < titles.length; t++) {
            setText(sheet, row + t, col, titles[t], t == 0 ? styles.header : styles.index);
            ReportStyles.merge(sheet, new CellRangeAddress(row + t, row + t, col, lastCol), BorderStyle.THIN);
        }
        int headerRow = row + NSS_TITLE_ROWS;
        for (int h = 0; h < NSS_HEADERS.length; h++) {
            setText(sheet, headerRow, col + h, NSS_HEADERS[h], styles.header);
        }

        double probabilitySum = 0;
        for (int b = 0; b < values.length; b++) {
            int r = headerRow + 1 + b;
            for (int c = 0; c < NssTable.COMPONENTS; c++) {
                double value = values[b][c];
                if (Double.isNaN(value)) {
                    setText(sheet, r, col + c, NAN_TEXT, styles.text);
                } else {
                    setNumber(sheet, r, col + c, value, c == NssTable.PROBABILITY ? styles.percent : styles.number);
                    if (c == NssTable.PROBABILITY) {
                        probabilitySum += value;
                    }
                }
            }
        }
        if (values.length > 0) {
            for (int c = 0; c < NssTable.COMPONENTS; c++) {
                ReportStyles.addColorScale(sheet,
                        new CellRangeAddress(headerRow + 1, headerRow + values.length, col + c, col + c));
            }
        }
        int sumRow = headerRow + 1 + values.length;
        for (int c = 0; c < NssTable.PROBABILITY; c++) {
            setText(sheet, sumRow, col + c, "", styles.text);
        }
        setNumber(sheet, sumRow, lastCol, probabilitySum, styles.percent);
    }

    // ---- 散点表 ----

    private void writeScatterTable(XSSFSheet sheet, ScatterTable table, int row, int col, BinType binType,
                                   ReportStyles styles) {
        int nx = table.columns();
        int ny = table.rows();
        DiscreteAxis xAxis = table.getXAxis();
        DiscreteAxis yAxis = table.getYAxis();
        ScatterRequest request = table.getRequest();

        setText(sheet, row, col, headerText(request), styles.header);
        ReportStyles.merge(sheet, new CellRangeAddress(row, row, col, col + nx + 3), BorderStyle.MEDIUM);

        setText(sheet, row + 2, col, AxisTitles.of(request.getYVariable()), styles.verticalAxisHeader);
        ReportStyles.merge(sheet, new CellRangeAddress(row + 2, row + 4 + ny, col, col), BorderStyle.MEDIUM);

        setText(sheet, row + 1, col + 1, AxisTitles.of(request.getXVariable()), styles.axisHeader);
        ReportStyles.merge(sheet, new CellRangeAddress(row + 1, row + 1, col + 1, col + 3 + nx), BorderStyle.MEDIUM);
        setText(sheet, row + 1, col, "", styles.axisHeader);

        setText(sheet, row + 2, col + 1, binType.getLowerHeader(), styles.boundsLabel);
        setText(sheet, row + 2, col + 2, "", styles.bounds);
        setText(sheet, row + 3, col + 1, "", styles.bounds);
        setText(sheet, row + 3, col + 2, binType.getUpperHeader(), styles.boundsLabel);

        for (int x = 0; x < nx; x++) {
            setNumber(sheet, row + 2, col + 3 + x, xAxis.lowerBound(x), styles.bounds);
            setNumber(sheet, row + 3, col + 3 + x, xAxis.upperBound(x), styles.bounds);
        }
        for (int y = 0; y < ny; y++) {
            setNumber(sheet, row + 4 + y, col + 1, yAxis.lowerBound(y), styles.bounds);
            setNumber(sheet, row + 4 + y, col + 2, yAxis.upperBound(y), styles.bounds);
        }

        for (int y = 0; y < ny; y++) {
            for (int x = 0; x < nx; x++) {
                double value = table.get(y, x);
                if (Double.isNaN(value)) {
                    setText(sheet, row + 4 + y, col + 3 + x, NAN_TEXT, styles.text);
                } else {
                    setNumber(sheet, row + 4 + y, col + 3 + x, value, styles.probability);
                }
            }
        }
        ReportStyles.addColorScale(sheet, new CellRangeAddress(row + 4, row + 3 + ny, col + 3, col + 2 + nx));

        int sumRow = row + 4 + ny;
        int sumCol = col + 3 + nx;
        setText(sheet, sumRow, col + 1, "SUM", styles.boundsLabel);
        ReportStyles.merge(sheet, new CellRangeAddress(sumRow, sumRow, col + 1, col + 2), BorderStyle.MEDIUM);
        setText(sheet, row + 2, sumCol, "SUM", styles.boundsLabel);
        ReportStyles.merge(sheet, new CellRangeAddress(row + 2, row + 3, sumCol, sumCol), BorderStyle.MEDIUM);

        double[] columnSums = table.columnSums();
        for (int x = 0; x < nx; x++) {
            setNumber(sheet, sumRow, col + 3 + x, columnSums[x], styles.total);
        }
        ReportStyles.addColorScale(sheet, new CellRangeAddress(sumRow, sumRow, col + 3, col + 2 + nx));

        double[] rowSums = table.rowSums();
        for (int y = 0; y < ny; y++) {
            setNumber(sheet, row + 4 + y, sumCol, rowSums[y], styles.total);
        }
        ReportStyles.addColorScale(sheet, new CellRangeAddress(row + 4, row + 3 + ny, sumCol, sumCol));

        setNumber(sheet, sumRow, sumCol, table.total(), styles.total);

        sheet.setColumnWidth(col, 4 * 256);
    }

    static String headerText(ScatterRequest request) {
        StringBuilder sb = new StringBuilder(AxisTitles.of(request.getXVariable()))
                .append(" Vs. ")
                .append(AxisTitles.of(request.getYVariable()));
        List<ColumnFilter> filters = request.getFilters();
        if (!filters.isEmpty()) {
            sb.append('.');
            for (int i = 0; i < filters.size(); i++) {
                sb.append(i == 0 ? " " : ", ").append(filters.get(i));
            }
            sb.append('.');
        }
        return sb.toString();
    }

    // ---- 单元格 ----

    private static XSSFCell cell(XSSFSheet sheet, int rowIndex, int colIndex) {
        XSSFRow row = sheet.getRow(rowIndex);
        if (row == null) {
            row = sheet.createRow(rowIndex);
        }
        XSSFCell cell = row.getCell(colIndex);
        return cell != null ? cell : row.createCell(colIndex);
    }

    private static void setText(XSSFSheet sheet, int row, int col, String value, XSSFCellStyle style) {
        XSSFCell cell = cell(sheet, row, col);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    private static void setNumber(XSSFSheet sheet, int row, int col, double value, XSSFCellStyle style) {
        XSSFCell cell = cell(sheet, row, col);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
