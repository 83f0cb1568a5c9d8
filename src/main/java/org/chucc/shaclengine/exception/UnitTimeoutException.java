package org.chucc.shaclengine.exception;

import java.time.Duration;

/**
 * Exception recorded when a validation unit exceeds its timeout.
 */
public class UnitTimeoutException extends ShaclEngineException {

  private static final long serialVersionUID = 1L;

  /**
   * Construct exception for the given timeout.
   *
   * @param timeout the timeout that was exceeded
   */
  public UnitTimeoutException(Duration timeout) {
    super("Validation unit timed out after " + timeout.toMillis() + " ms", "unit_timeout");
  }
}
