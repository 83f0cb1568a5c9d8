package org.chucc.shaclengine.exception;

/**
 * Exception thrown when validation options are invalid.
 *
 * <p>Raised before any unit is dispatched and fails the whole run with error
 * code 'invalid_options'.</p>
 */
public class InvalidOptionsException extends ShaclEngineException {

  private static final long serialVersionUID = 1L;

  /**
   * Construct exception with message.
   *
   * @param message error message
   */
  public InvalidOptionsException(String message) {
    super(message, "invalid_options");
  }
}
