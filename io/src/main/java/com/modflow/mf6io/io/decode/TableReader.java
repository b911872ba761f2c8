package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.io.parse.ast.LineNode;
import com.modflow.mf6io.io.value.TableValue;
import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.ParamSpec;
import java.util.List;

/** Reads the rows of a list-input ({@code recarray}) parameter. */
public interface TableReader {

    /**
     * @param table the table parameter; its components are the columns
     * @param rows the block lines that belong to the table, in file order
     * @param context dimensions known at this point of the decode
     */
    TableValue read(ParamSpec table, List<LineNode> rows, DimensionContext context) throws Mf6Exception;
}
