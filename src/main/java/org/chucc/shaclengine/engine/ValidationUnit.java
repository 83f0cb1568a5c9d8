package org.chucc.shaclengine.engine;

import java.util.Objects;
import org.apache.jena.graph.Node;
import org.chucc.shaclengine.model.NodeShape;

/**
 * The unit of work: one node shape applied to one focus node.
 *
 * @param shape the node shape
 * @param focusNode the focus node selected by the shape
 */
public record ValidationUnit(NodeShape shape, Node focusNode) {

  /**
   * Creates a ValidationUnit with validation.
   */
  public ValidationUnit {
    Objects.requireNonNull(shape, "Shape cannot be null");
    Objects.requireNonNull(focusNode, "Focus node cannot be null");
  }
}
