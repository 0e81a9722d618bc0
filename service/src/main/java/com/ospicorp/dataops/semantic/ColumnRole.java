package com.ospicorp.dataops.semantic;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Semantic category of a column. Declaration order is classification precedence, except
 * {@link #TEXT} which is the fallback.
 */
public enum ColumnRole {
  IDENTIFIER,
  DATE,
  BOOLEAN,
  MONETARY,
  RATE,
  DERIVED,
  NUMERIC,
  TEXT;

  /** Roles whose values are measured quantities, as opposed to keys, flags and labels. */
  public boolean isMeasure() {
    return this == MONETARY || this == RATE || this == DERIVED || this == NUMERIC;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
