package org.chucc.shaclengine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Node;

/**
 * A single validation result.
 *
 * <p>Details keep insertion order. Values are either Jena {@link Node}s or
 * primitives (numbers, strings).</p>
 *
 * @param focusNode the node that was validated
 * @param path the property path, or null for node-level results
 * @param sourceShape the shape that produced this result
 * @param severity the result severity
 * @param message human-readable message
 * @param details additional details, in insertion order
 */
public record ValidationResult(
    Node focusNode,
    Node path,
    Node sourceShape,
    Severity severity,
    String message,
    Map<String, Object> details
) {

  /**
   * Creates a ValidationResult with an unmodifiable copy of the details.
   */
  public ValidationResult {
    Objects.requireNonNull(focusNode, "Focus node cannot be null");
    Objects.requireNonNull(sourceShape, "Source shape cannot be null");
    Objects.requireNonNull(severity, "Severity cannot be null");
    Objects.requireNonNull(message, "Message cannot be null");
    details = details == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  /**
   * Checks whether this result is a violation.
   *
   * @return true if severity is {@link Severity#VIOLATION}
   */
  public boolean isViolation() {
    return severity == Severity.VIOLATION;
  }
}
