package com.metocean.report.core;

import com.metocean.report.model.BinTable;
import com.metocean.report.model.BinType;
import com.metocean.report.model.ObservationDataset;

/**
 * 处理上下文接口：处理器与系统交互的唯一桥梁。
 *
 * 为处理器提供三个能力：
 * 1. 访问正在构建的数据集
 * 2. 读取步骤参数
 * 3. 向分箱表发布坐标轴
 */
public interface ProcessingContext {

    /**
     * @return 正在处理的数据集，处理器可向其追加列
     */
    ObservationDataset getDataset();

    /**
     * @return 本次运行共享的分箱表
     */
    BinTable getBinTable();

    /**
     * @return 分箱与扇区划分使用的边界闭合方式
     */
    BinType getBinType();

    /**
     * 获取指定名称的步骤参数，支持泛型类型安全转换。
     *
     * @param paramName    参数名称
     * @param defaultValue 参数不存在时的默认值，同时用于推断返回类型
     * @param <T>          参数值类型
     * @return 参数值；参数不存在时返回defaultValue
     */
    <T> T getParameter(String paramName, T defaultValue);
}
