package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.io.parse.ast.LineNode;
import com.modflow.mf6io.io.value.RecordValue;
import com.modflow.mf6io.io.value.TableValue;
import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.ParamSpec;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every line as one row, decoding the columns like the components of a record. When the
 * table's shape resolves ({@code (maxbound)}) it bounds the number of rows.
 */
public final class RowTableReader implements TableReader {

    @Override
    public TableValue read(ParamSpec table, List<LineNode> rows, DimensionContext context) throws Mf6Exception {
        int[] bound = rows.isEmpty()
                ? null
                : context.resolveIfKnown(table.getShape(), rows.get(0).getLocation(), table.getName());
        if (bound != null && bound.length == 1 && rows.size() > bound[0]) {
            LineNode extra = rows.get(bound[0]);
            throw new ShapeMismatchException(
                    "Table '" + table.getName() + "' has more than " + bound[0] + " rows",
                    extra.getLocation(),
                    extra.text());
        }
        RecordReader reader = new RecordReader(context);
        List<RecordValue> values = new ArrayList<>(rows.size());
        for (LineNode row : rows) {
            values.add(reader.readRow(table, row));
        }
        List<String> columns = new ArrayList<>();
        for (ParamSpec column : table.getComponents()) {
            columns.add(column.getName());
        }
        return new TableValue(columns, values);
    }
}
