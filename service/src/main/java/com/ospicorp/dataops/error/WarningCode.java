package com.ospicorp.dataops.error;

public enum WarningCode {
  IDENTIFIER_OVERRIDE_REJECTED,
  DERIVED_COLUMN_AGGREGATED,
  UNSUPPORTED_FUNCTION_FOR_ROLE,
  TEXT_COLUMN_DROPPED,
  SORT_COLUMN_NOT_FOUND,
  PIVOT_SIZE,
  PIVOT_INDEX_RECONSTRUCTED
}
