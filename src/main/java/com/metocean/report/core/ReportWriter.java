package com.metocean.report.core;

import com.metocean.report.model.NssReport;
import com.metocean.report.model.ScatterReport;

import java.nio.file.Path;

/**
 * 报表输出接口：把计算完成的表格渲染为文件。
 *
 * 版式、样式、合并单元格和条件格式都属于实现类，
 * 引擎只交付带坐标轴的结构化表格。
 */
public interface ReportWriter {

    /**
     * 输出NSS报表
     *
     * @param report NSS表格集合
     * @return 生成的文件路径
     */
    Path writeNssReport(NssReport report);

    /**
     * 输出散点报表
     *
     * @param report 散点表格集合
     * @return 生成的文件路径
     */
    Path writeScatterReport(ScatterReport report);
}
