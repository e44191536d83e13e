package com.metocean.report.processors;

import com.metocean.report.core.DatasetProcessor;
import com.metocean.report.core.ProcessingContext;
import com.metocean.report.engine.Binner;
import com.metocean.report.model.BinAxis;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.ParameterDefinition;
import com.metocean.report.model.ProcessorMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 分箱处理器。
 * 按列的观测最大值和分箱宽度确定分箱轴，发布到分箱表，并追加 "&lt;column&gt;_bins" 列。
 *
 * 参数：
 * - column: 源列名 (STRING, 必选)
 * - width: 分箱宽度 (NUMBER, 必选, 大于0)
 */
public class BinningProcessor implements DatasetProcessor {

    private static final Logger log = LoggerFactory.getLogger(BinningProcessor.class);

    public static final String ID = "binning";
    public static final String SUFFIX = "_bins";

    @Override
    public void execute(ProcessingContext context) {
        String column = context.getParameter("column", "");
        double width = context.getParameter("width", Double.NaN);
        ObservationDataset dataset = context.getDataset();

        double[] values = dataset.getColumn(column);
        BinAxis axis = Binner.axisFor(column, values, width);
        context.getBinTable().publish(axis);
        dataset.addDiscreteColumn(Binner.binColumn(column + SUFFIX, axis, values, context.getBinType()));
        log.debug("Binned {} into {} bins of width {}", column, axis.size(), width);
    }

    @Override
    public ProcessorMetadata getMetadata() {
        ProcessorMetadata meta = new ProcessorMetadata();
        meta.setProcessorId(ID);
        meta.setName("分箱处理器");
        meta.setVersion("1.0.0");
        meta.setDescription("把连续变量按固定宽度分箱，边界从0开始，超出最后边界的值并入最高分箱。");

        ParameterDefinition columnDef = new ParameterDefinition("column", ParameterDefinition.Type.STRING,
                true, "源列名");
        ParameterDefinition widthDef = new ParameterDefinition("width", ParameterDefinition.Type.NUMBER,
                true, "分箱宽度").range(1e-6, null);

        meta.setParameterDefinitions(Arrays.asList(columnDef, widthDef));
        return meta;
    }
}
