package com.ospicorp.dataops.outliers;

import com.fasterxml.jackson.annotation.JsonValue;
import com.ospicorp.dataops.error.InvalidInputException;
import java.util.Locale;

public enum OutlierMethod {
  IQR("iqr", false),
  ZSCORE("zscore", false),
  ISOLATION_FOREST("isolation_forest", true),
  LOCAL_OUTLIER_FACTOR("local_outlier_factor", true);

  private final String methodName;
  private final boolean needsBackend;

  OutlierMethod(String methodName, boolean needsBackend) {
    this.methodName = methodName;
    this.needsBackend = needsBackend;
  }

  @JsonValue
  public String methodName() {
    return methodName;
  }

  /** Whether detection is delegated to an {@link OutlierScoringBackend}. */
  public boolean needsBackend() {
    return needsBackend;
  }

  public static OutlierMethod fromName(String name) {
    if (name == null || name.isBlank()) return IQR;
    String key = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return switch (key) {
      case "iqr" -> IQR;
      case "zscore", "z_score" -> ZSCORE;
      case "isolation_forest", "iforest" -> ISOLATION_FOREST;
      case "local_outlier_factor", "lof" -> LOCAL_OUTLIER_FACTOR;
      default -> throw new InvalidInputException("Unknown outlier method \"" + name + "\"",
          "unknown-method", "Supported methods: iqr, zscore, isolation_forest, local_outlier_factor");
    };
  }
}
