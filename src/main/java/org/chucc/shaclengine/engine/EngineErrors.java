package org.chucc.shaclengine.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.chucc.shaclengine.exception.ShaclEngineException;
import org.chucc.shaclengine.model.Severity;
import org.chucc.shaclengine.model.ValidationResult;

/**
 * Converts unit failures into {@link Severity#ENGINE_ERROR} results.
 */
final class EngineErrors {

  static final String ERROR_CODE = "error_code";
  static final String UNIT_FAILURE = "unit_failure";
  static final String INTERRUPTED = "interrupted";

  private EngineErrors() {
    // Utility class - prevent instantiation
  }

  /**
   * Builds the single engine error result for a failed unit.
   *
   * @param unit the failed unit
   * @param failure the failure
   * @return the engine error result
   */
  static ValidationResult fromFailure(ValidationUnit unit, Throwable failure) {
    Throwable cause = unwrap(failure);
    String code = cause instanceof ShaclEngineException engineException
        ? engineException.getCode()
        : UNIT_FAILURE;

    String type = cause.getClass().getSimpleName();
    String message = cause.getMessage() != null ? cause.getMessage() : type;

    Map<String, Object> details = new LinkedHashMap<>();
    details.put(ERROR_CODE, code);
    details.put("error_type", type);
    details.put("error_message", message);

    return new ValidationResult(
        unit.focusNode(),
        null,
        unit.shape().id(),
        Severity.ENGINE_ERROR,
        "Validation unit failed (" + code + "): " + message,
        details);
  }

  /**
   * Builds the engine error result for a unit abandoned because the run was
   * interrupted.
   *
   * @param unit the abandoned unit
   * @return the engine error result
   */
  static ValidationResult interrupted(ValidationUnit unit) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put(ERROR_CODE, INTERRUPTED);
    return new ValidationResult(
        unit.focusNode(),
        null,
        unit.shape().id(),
        Severity.ENGINE_ERROR,
        "Validation unit abandoned: run was interrupted",
        details);
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
