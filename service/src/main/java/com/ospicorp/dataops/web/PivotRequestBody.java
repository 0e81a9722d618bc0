package com.ospicorp.dataops.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.dataops.ops.PivotRequest;
import java.util.List;
import java.util.Map;

public record PivotRequestBody(
    List<Map<String, Object>> data,
    @JsonProperty("index_column") String indexColumn,
    @JsonProperty("value_columns") List<String> valueColumns,
    Map<String, String> functions
) {
  PivotRequest toRequest() {
    return new PivotRequest(indexColumn, valueColumns, functions);
  }
}
