package com.ospicorp.dataops.outliers;

import com.ospicorp.dataops.table.Table;

public record TreatResult(
    Table data,
    int rowsBefore,
    int rowsAfter,
    int treatedCount,
    TreatmentSummary summary
) {}
