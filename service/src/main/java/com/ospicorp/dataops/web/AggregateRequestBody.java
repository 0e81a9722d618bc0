package com.ospicorp.dataops.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.dataops.ops.AggregateRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.Map;

public record AggregateRequestBody(
    @Schema(description = "Rows as objects keyed by column name")
    List<Map<String, Object>> data,
    @JsonProperty("group_by") @Schema(example = "region") String groupBy,
    @JsonProperty("value_columns") List<String> valueColumns,
    @Schema(description = "Function per column, e.g. {\"price\": \"avg\"}")
    Map<String, String> functions,
    @JsonProperty("order_by") String orderBy,
    @JsonProperty("order_direction") @Schema(allowableValues = {"asc", "desc"})
    String orderDirection,
    @Schema(example = "average order value") String intent
) {
  AggregateRequest toRequest() {
    return new AggregateRequest(groupBy, valueColumns, functions, orderBy, orderDirection, intent);
  }
}
