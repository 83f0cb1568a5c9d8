package org.chucc.shaclengine.exception;

/**
 * Exception thrown when a rule constraint query cannot be executed.
 *
 * <p>This indicates a technical failure (malformed query, unsupported graph,
 * engine error), not a constraint violation. The engine turns it into an
 * engine error result for the affected unit.</p>
 */
public class QueryExecutionException extends ShaclEngineException {

  private static final long serialVersionUID = 1L;

  /**
   * Construct exception with message.
   *
   * @param message error message
   */
  public QueryExecutionException(String message) {
    super(message, "query_error");
  }

  /**
   * Construct exception with message and cause.
   *
   * @param message error message
   * @param cause underlying exception
   */
  public QueryExecutionException(String message, Throwable cause) {
    super(message, "query_error", cause);
  }
}
