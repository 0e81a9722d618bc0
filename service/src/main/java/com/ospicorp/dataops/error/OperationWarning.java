package com.ospicorp.dataops.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/** A condition worth reporting that did not stop the operation. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationWarning(
    WarningCode code,
    String column,
    String message
) {}
