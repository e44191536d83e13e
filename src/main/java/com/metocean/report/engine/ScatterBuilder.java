package com.metocean.report.engine;

import com.metocean.report.model.ColumnFilter;
import com.metocean.report.model.DiscreteColumn;
import com.metocean.report.model.ObservationDataset;
import com.metocean.report.model.ScatterRequest;
import com.metocean.report.model.ScatterTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 散点表（联合频率表）构建。
 *
 * 过滤条件的标签值先解析为坐标轴位置，然后对数据集做一次分组计数，
 * 概率 = 计数 / 未过滤数据集总行数，计数为0的单元记为NaN。
 */
public class ScatterBuilder {

    private static final Logger log = LoggerFactory.getLogger(ScatterBuilder.class);

    public ScatterTable build(ObservationDataset dataset, ScatterRequest request) {
        DiscreteColumn x = dataset.getDiscreteColumn(request.getXVariable());
        DiscreteColumn y = dataset.getDiscreteColumn(request.getYVariable());
        int columns = x.getAxis().size();
        int rows = y.getAxis().size();

        List<ColumnFilter> filters = request.getFilters();
        DiscreteColumn[] filterColumns = new DiscreteColumn[filters.size()];
        int[] filterPositions = new int[filters.size()];
        boolean satisfiable = true;
        for (int f = 0; f < filters.size(); f++) {
            ColumnFilter filter = filters.get(f);
            filterColumns[f] = dataset.getDiscreteColumn(filter.getColumn());
            filterPositions[f] = filterColumns[f].getAxis().positionOf(filter.getValue());
            if (filterPositions[f] == DiscreteColumn.MISSING) {
                log.debug("Filter {} matches no axis position of {}", filter, filterColumns[f].getAxis());
                satisfiable = false;
            }
        }

        int[] counts = new int[rows * columns];
        if (satisfiable) {
            for (int row = 0; row < dataset.size(); row++) {
                if (!matches(row, filterColumns, filterPositions)) {
                    continue;
                }
                int xp = x.position(row);
                int yp = y.position(row);
                if (xp == DiscreteColumn.MISSING || yp == DiscreteColumn.MISSING) {
                    continue;
                }
                counts[yp * columns + xp]++;
            }
        }

        double total = dataset.size();
        double[][] values = new double[rows][columns];
        for (int yp = 0; yp < rows; yp++) {
            for (int xp = 0; xp < columns; xp++) {
                int count = counts[yp * columns + xp];
                values[yp][xp] = count == 0 ? Double.NaN : count / total;
            }
        }
        return new ScatterTable(request, x.getAxis(), y.getAxis(), values);
    }

    private static boolean matches(int row, DiscreteColumn[] columns, int[] positions) {
        for (int f = 0; f < columns.length; f++) {
            if (columns[f].position(row) != positions[f]) {
                return false;
            }
        }
        return true;
    }
}
