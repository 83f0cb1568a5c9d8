package org.chucc.shaclengine.exception;

/**
 * Base exception for validation engine errors.
 * Contains a canonical error code that is carried into engine error results.
 */
public class ShaclEngineException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;

  /**
   * Constructor with message and code.
   *
   * @param message error message
   * @param code canonical error code
   */
  public ShaclEngineException(String message, String code) {
    super(message);
    this.code = code;
  }

  /**
   * Constructor with message, code, and cause.
   *
   * @param message error message
   * @param code canonical error code
   * @param cause the cause
   */
  public ShaclEngineException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
