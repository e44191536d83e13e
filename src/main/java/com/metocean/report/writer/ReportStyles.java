package com.metocean.report.writer;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.ConditionalFormattingThreshold.RangeType;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.RegionUtil;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFColorScaleFormatting;
import org.apache.poi.xssf.usermodel.XSSFConditionalFormattingRule;
import org.apache.poi.xssf.usermodel.XSSFConditionalFormattingThreshold;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFSheetConditionalFormatting;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * 报表单元格样式。每个工作簿创建一份，所有单元格共享，避免样式数量膨胀。
 */
class ReportStyles {

    static final String DARK = "072B31";
    static final String LIGHT_GREY = "D9D9D6";
    static final String GREY = "C0C0C0";
    static final String WIND_YELLOW = "FFE900";
    static final String WAVE_BLUE = "01C1D5";

    /** 三色刻度：最小值绿、中位数黄、最大值红 */
    static final String SCALE_LOW = "63BE7B";
    static final String SCALE_MID = "FFEB84";
    static final String SCALE_HIGH = "F8696B";

    final XSSFCellStyle header;
    final XSSFCellStyle index;
    final XSSFCellStyle windHeader;
    final XSSFCellStyle waveHeader;
    final XSSFCellStyle number;
    final XSSFCellStyle percent;
    final XSSFCellStyle text;
    final XSSFCellStyle axisHeader;
    final XSSFCellStyle verticalAxisHeader;
    final XSSFCellStyle bounds;
    final XSSFCellStyle boundsLabel;
    final XSSFCellStyle probability;
    final XSSFCellStyle total;

    ReportStyles(XSSFWorkbook workBook) {
        XSSFFont whiteBold = workBook.createFont();
        whiteBold.setBold(true);
        whiteBold.setColor(color("FFFFFF"));
        XSSFFont bold = workBook.createFont();
        bold.setBold(true);

        text = workBook.createCellStyle();
        text.setAlignment(HorizontalAlignment.CENTER);
        text.setVerticalAlignment(VerticalAlignment.CENTER);
        thinBorder(text);

        header = filled(workBook, DARK);
        header.setFont(whiteBold);

        index = filled(workBook, LIGHT_GREY);
        index.setFont(bold);
        windHeader = filled(workBook, WIND_YELLOW);
        windHeader.setFont(bold);
        waveHeader = filled(workBook, WAVE_BLUE);
        waveHeader.setFont(bold);

        number = workBook.createCellStyle();
        number.cloneStyleFrom(text);
        number.setDataFormat(workBook.createDataFormat().getFormat("0.00"));
        percent = workBook.createCellStyle();
        percent.cloneStyleFrom(text);
        percent.setDataFormat(workBook.createDataFormat().getFormat("0.00%"));
        probability = workBook.createCellStyle();
        probability.cloneStyleFrom(text);
        probability.setDataFormat(workBook.createDataFormat().getFormat("0.000%"));

        axisHeader = filled(workBook, GREY);
        axisHeader.setFont(bold);
        verticalAxisHeader = filled(workBook, GREY);
        verticalAxisHeader.setFont(bold);
        verticalAxisHeader.setRotation((short) 90);
        bounds = filled(workBook, GREY);
        bounds.setDataFormat(workBook.createDataFormat().getFormat("0.0###"));
        boundsLabel = filled(workBook, GREY);
        boundsLabel.setFont(bold);

        total = workBook.createCellStyle();
        total.cloneStyleFrom(probability);
        total.setFont(bold);
        total.setBorderTop(BorderStyle.MEDIUM);
        total.setBorderBottom(BorderStyle.MEDIUM);
    }

    /**
     * 对区域添加三色刻度条件格式
     */
    static void addColorScale(XSSFSheet sheet, CellRangeAddress region) {
        XSSFSheetConditionalFormatting formatting = sheet.getSheetConditionalFormatting();
        XSSFConditionalFormattingRule rule = formatting.createConditionalFormattingColorScaleRule();
        XSSFColorScaleFormatting scale = rule.getColorScaleFormatting();

        XSSFConditionalFormattingThreshold low = scale.createThreshold();
        low.setRangeType(RangeType.MIN);
        XSSFConditionalFormattingThreshold mid = scale.createThreshold();
        mid.setRangeType(RangeType.PERCENTILE);
        mid.setValue(50d);
        XSSFConditionalFormattingThreshold high = scale.createThreshold();
        high.setRangeType(RangeType.MAX);

        scale.setThresholds(new XSSFConditionalFormattingThreshold[] {low, mid, high});
        scale.setColors(new XSSFColor[] {color(SCALE_LOW), color(SCALE_MID), color(SCALE_HIGH)});
        formatting.addConditionalFormatting(new CellRangeAddress[] {region}, rule);
    }

    /**
     * 合并区域并描外框；单个单元格不合并
     */
    static void merge(XSSFSheet sheet, CellRangeAddress region, BorderStyle border) {
        if (region.getNumberOfCells() > 1) {
            sheet.addMergedRegion(region);
        }
        RegionUtil.setBorderTop(border, region, sheet);
        RegionUtil.setBorderBottom(border, region, sheet);
        RegionUtil.setBorderLeft(border, region, sheet);
        RegionUtil.setBorderRight(border, region, sheet);
    }

    static XSSFColor color(String hex) {
        int rgb = Integer.parseInt(hex, 16);
        return new XSSFColor(new byte[] {(byte) (rgb >> 16), (byte) (rgb >> 8), (byte) rgb}, null);
    }

    private static XSSFCellStyle filled(XSSFWorkbook workBook, String hex) {
        XSSFCellStyle style = workBook.createCellStyle();
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        style.setFillForegroundColor(color(hex));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        thinBorder(style);
        return style;
    }

    private static void thinBorder(XSSFCellStyle style) {
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
    }
}
