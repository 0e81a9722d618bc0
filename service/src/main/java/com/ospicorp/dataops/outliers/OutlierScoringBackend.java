package com.ospicorp.dataops.outliers;

/**
 * Optional statistical backend for the density and isolation based detection methods. Register
 * implementations as Spring beans; {@link OutlierDetector} picks the first one that supports the
 * requested method.
 */
public interface OutlierScoringBackend {

  boolean supports(OutlierMethod method);

  /**
   * Flags outliers among the non-missing values of one column.
   *
   * @param values the column's numeric values, in row order
   * @param threshold method-specific sensitivity, {@code null} for the backend's default
   * @return one flag per input value
   */
  boolean[] flag(OutlierMethod method, double[] values, Double threshold);
}
