package com.metocean.report.model;

/**
 * 功能开关集合。
 * 决定数据集中存在哪些列、计算哪些表格。
 */
public enum Feature {
    /** 轮毂高度风数据 */
    WIND,
    /** 额外的10m高度风数据 */
    WIND_10M,
    /** 波浪数据 */
    WAVE,
    /** 波浪谱分解（风浪 / 涌浪） */
    WAVE_SPECTRAL,
    /** 输入文件中带实测谱峰升高因子 */
    PEAK_ENHANCEMENT,
    /** 缺少实测值时由Hs/Tp推算谱峰升高因子 */
    DERIVE_PEAK_ENHANCEMENT,
    /** 海流数据 */
    CURRENT,
    /** 海流分解为潮流和余流 */
    CURRENT_COMPONENTS,
    /** 海水温盐数据 */
    WATER,
    /** 输出NSS报表 */
    NSS_REPORT,
    /** 输出散点报表 */
    SCATTER_REPORT
}
