package org.chucc.shaclengine.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Node;

/**
 * One solution row of a rule query: variable name to bound term.
 *
 * <p>Unbound variables are absent. Iteration follows the query's projection
 * order.</p>
 *
 * @param bindings variable name (without '?') to bound term
 */
public record BindingRow(Map<String, Node> bindings) {

  /**
   * Creates a BindingRow with an ordered, unmodifiable copy of the bindings.
   */
  public BindingRow {
    Objects.requireNonNull(bindings, "Bindings cannot be null");
    bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
  }

  /**
   * Gets the term bound to a variable.
   *
   * @param variable the variable name without '?'
   * @return the bound term, or null if unbound
   */
  public Node get(String variable) {
    return bindings.get(variable);
  }
}
