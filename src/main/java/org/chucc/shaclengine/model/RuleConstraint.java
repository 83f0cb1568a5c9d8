package org.chucc.shaclengine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Node;

/**
 * Node-level constraint expressed as a SPARQL SELECT query.
 *
 * <p>The query template refers to the focus node through one or more {@code $this}
 * placeholders. Every solution row of the bound query is a violation.</p>
 *
 * @param sourceShapeId the node shape owning this constraint
 * @param queryTemplate SPARQL SELECT query containing {@code $this}
 * @param message violation message (optional)
 * @param prefixes prefix declarations prepended to the query, in order
 */
public record RuleConstraint(
    Node sourceShapeId,
    String queryTemplate,
    String message,
    Map<String, String> prefixes
) {

  /**
   * Creates a RuleConstraint with validation.
   *
   * @throws IllegalArgumentException if the query template is blank
   */
  public RuleConstraint {
    Objects.requireNonNull(sourceShapeId, "Source shape id cannot be null");
    Objects.requireNonNull(queryTemplate, "Query template cannot be null");
    if (queryTemplate.isBlank()) {
      throw new IllegalArgumentException("Query template cannot be blank");
    }
    prefixes = prefixes == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
  }

  /**
   * Creates a RuleConstraint without prefix declarations.
   *
   * @param sourceShapeId the owning node shape
   * @param queryTemplate the query template
   * @param message the violation message, or null
   */
  public RuleConstraint(Node sourceShapeId, String queryTemplate, String message) {
    this(sourceShapeId, queryTemplate, message, Map.of());
  }
}
