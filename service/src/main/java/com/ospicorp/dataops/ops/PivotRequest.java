package com.ospicorp.dataops.ops;

import java.util.List;
import java.util.Map;

public record PivotRequest(
    String indexColumn,
    List<String> valueColumns,
    Map<String, String> functions
) {}
