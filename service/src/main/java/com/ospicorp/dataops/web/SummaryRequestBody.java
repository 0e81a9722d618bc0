package com.ospicorp.dataops.web;

import java.util.List;
import java.util.Map;

public record SummaryRequestBody(
    List<Map<String, Object>> data,
    String column
) {}
