package com.ospicorp.dataops.outliers;

import com.fasterxml.jackson.annotation.JsonValue;
import com.ospicorp.dataops.error.InvalidInputException;
import java.util.Locale;

public enum TreatmentStrategy {
  REMOVE,
  CAP,
  WINSORIZE,
  TRANSFORM,
  IMPUTE;

  @JsonValue
  public String strategyName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TreatmentStrategy fromName(String name) {
    if (name == null || name.isBlank()) return REMOVE;
    String key = name.trim().toLowerCase(Locale.ROOT);
    return switch (key) {
      case "remove", "drop", "delete" -> REMOVE;
      case "cap", "clip" -> CAP;
      case "winsorize", "winsorise" -> WINSORIZE;
      case "transform", "log" -> TRANSFORM;
      case "impute", "replace" -> IMPUTE;
      default -> throw new InvalidInputException("Unknown treatment strategy \"" + name + "\"",
          "unknown-strategy", "Supported strategies: remove, cap, winsorize, transform, impute");
    };
  }
}
