package com.ospicorp.dataops.ops;

import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.semantic.AggregationSpec;
import com.ospicorp.dataops.table.Table;
import java.util.List;

/**
 * @param data pivoted rows; the index column holds reconstructed values, see
 *     {@link PivotReshaper}
 */
public record PivotResult(
    Table data,
    int rowsBefore,
    int rowsAfter,
    List<String> preservedColumns,
    List<AggregationSpec> specs,
    List<OperationWarning> warnings
) {}
