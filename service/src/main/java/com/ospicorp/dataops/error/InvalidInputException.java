package com.ospicorp.dataops.error;

import java.util.Collection;

/**
 * The request names something the table does not have, or leaves nothing to operate on.
 * {@link #moreInfo()} carries what the caller needs to fix it.
 */
public class InvalidInputException extends DataOpsException {

  public InvalidInputException(String message, String errorCode, String moreInfo) {
    super(message, errorCode, moreInfo);
  }

  public static InvalidInputException unknownColumn(String column, Collection<String> available) {
    return new InvalidInputException("Column \"" + column + "\" was not found",
        "unknown-column", "Available columns: " + String.join(", ", available));
  }
}
