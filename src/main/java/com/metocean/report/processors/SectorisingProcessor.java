package com.metocean.report.processors;

import com.metocean.report.core.DatasetProcessor;
import com.metocean.report.core.ProcessingContext;
import com.metocean.report.engine.Sectoriser;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.ParameterDefinition;
import com.metocean.report.model.ProcessorMetadata;
import com.metocean.report.model.SectorAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 扇区划分处理器，追加 "&lt;column&gt;_sectors" 列。
 *
 * 参数：
 * - column: 方向列名 (STRING, 必选)
 * - sectors: 扇区数 (INTEGER, 必选, 1..360)
 */
public class SectorisingProcessor implements DatasetProcessor {

    private static final Logger log = LoggerFactory.getLogger(SectorisingProcessor.class);

    public static final String ID = "sectorising";
    public static final String SUFFIX = "_sectors";

    @Override
    public void execute(ProcessingContext context) {
        String column = context.getParameter("column", "");
        int sectors = context.getParameter("sectors", 0);
        ObservationDataset dataset = context.getDataset();

        SectorAxis axis = new SectorAxis(column, sectors);
        dataset.addDiscreteColumn(Sectoriser.sectorColumn(column + SUFFIX, axis,
                dataset.getColumn(column), context.getBinType()));
        log.debug("Sectorised {} into {} sectors of {} deg", column, sectors, axis.getSectorWidth());
    }

    @Override
    public ProcessorMetadata getMetadata() {
        ProcessorMetadata meta = new ProcessorMetadata();
        meta.setProcessorId(ID);
        meta.setName("扇区划分处理器");
        meta.setVersion("1.0.0");
        meta.setDescription("把方向角划分为N个等宽扇区，扇区1以0°为中心。");

        ParameterDefinition columnDef = new ParameterDefinition("column", ParameterDefinition.Type.STRING,
                true, "方向列名");
        ParameterDefinition sectorsDef = new ParameterDefinition("sectors", ParameterDefinition.Type.INTEGER,
                true, "扇区数").range(1.0, 360.0);

        meta.setParameterDefinitions(Arrays.asList(columnDef, sectorsDef));
        return meta;
    }
}
