package com.metocean.report.processors;

import com.metocean.report.core.DatasetProcessor;
import com.metocean.report.core.ProcessingContext;
import com.metocean.report.engine.PeakEnhancement;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.ParameterDefinition;
import com.metocean.report.model.ProcessorMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 谱峰升高因子处理器。
 * DERIVE 模式由 Hs/Tp 逐行推算；CONSTANT 模式整列填充固定值（涌浪）。
 *
 * 参数：
 * - mode: 计算方式 (ENUM: DERIVE / CONSTANT, 必选)
 * - target: 输出列名 (STRING, 必选)
 * - height: 有效波高列名 (STRING, DERIVE时使用)
 * - period: 谱峰周期列名 (STRING, DERIVE时使用)
 * - value: 固定值 (NUMBER, CONSTANT时使用, 默认10)
 */
public class PeakEnhancementProcessor implements DatasetProcessor {

    private static final Logger log = LoggerFactory.getLogger(PeakEnhancementProcessor.class);

    public static final String ID = "peak_enhancement";
    public static final String MODE_DERIVE = "DERIVE";
    public static final String MODE_CONSTANT = "CONSTANT";

    @Override
    public void execute(ProcessingContext context) {
        String mode = context.getParameter("mode", MODE_DERIVE);
        String target = context.getParameter("target", "");
        ObservationDataset dataset = context.getDataset();

        double[] gamma;
        if (MODE_CONSTANT.equals(mode)) {
            double value = context.getParameter("value", 10.0);
            gamma = new double[dataset.size()];
            Arrays.fill(gamma, value);
            log.debug("Filled {} with constant peak enhancement {}", target, value);
        } else {
            String height = context.getParameter("height", "");
            String period = context.getParameter("period", "");
            if (height.isEmpty() || period.isEmpty()) {
                throw new IllegalArgumentException("Peak enhancement derivation for '" + target
                        + "' needs both height and period columns");
            }
            gamma = PeakEnhancement.deriveColumn(dataset, height, period);
            log.debug("Derived {} from {} and {}", target, height, period);
        }
        dataset.addColumn(target, gamma);
    }

    @Override
    public ProcessorMetadata getMetadata() {
        ProcessorMetadata meta = new ProcessorMetadata();
        meta.setProcessorId(ID);
        meta.setName("谱峰升高因子处理器");
        meta.setVersion("1.0.0");
        meta.setDescription("按DNV-GL公式由Hs、Tp推算JONSWAP谱峰升高因子γ，或填充固定值。");

        ParameterDefinition modeDef = new ParameterDefinition("mode", ParameterDefinition.Type.ENUM,
                true, "计算方式").options(Arrays.asList(MODE_DERIVE, MODE_CONSTANT));
        ParameterDefinition targetDef = new ParameterDefinition("target", ParameterDefinition.Type.STRING,
                true, "输出列名");
        ParameterDefinition heightDef = new ParameterDefinition("height", ParameterDefinition.Type.STRING,
                false, "有效波高列名（DERIVE时使用）");
        ParameterDefinition periodDef = new ParameterDefinition("period", ParameterDefinition.Type.STRING,
                false, "谱峰周期列名（DERIVE时使用）");
        ParameterDefinition valueDef = new ParameterDefinition("value", ParameterDefinition.Type.NUMBER,
                false, "固定值（CONSTANT时使用）").range(0.0, null).defaultsTo(10.0);

        meta.setParameterDefinitions(Arrays.asList(modeDef, targetDef, heightDef, periodDef, valueDef));
        return meta;
    }
}
