package com.ospicorp.dataops.ops;

import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.semantic.AggregationSpec;
import com.ospicorp.dataops.table.Table;
import java.util.List;

public record AggregateResult(
    Table data,
    int rowsBefore,
    int rowsAfter,
    List<AggregationSpec> specs,
    List<OperationWarning> warnings
) {}
