package org.chucc.shaclengine.model;

import java.util.List;
import java.util.Objects;
import org.apache.jena.graph.Node;

/**
 * A node shape: target classes plus the property shapes and rule constraints
 * applied to every focus node it selects.
 *
 * <p>{@code implicitClassTarget} is set when the shape is itself a class; its
 * instances are then targeted in addition to {@code targetClasses}.</p>
 *
 * @param id the shape identifier (IRI or blank node)
 * @param targetClasses classes whose instances are focus nodes
 * @param propertyShapes property shapes, in evaluation order
 * @param ruleConstraints rule constraints, in evaluation order
 * @param implicitClassTarget implicit class target (optional)
 */
public record NodeShape(
    Node id,
    List<Node> targetClasses,
    List<PropertyShape> propertyShapes,
    List<RuleConstraint> ruleConstraints,
    Node implicitClassTarget
) {

  /**
   * Creates a NodeShape with defensive copies of all lists.
   */
  public NodeShape {
    Objects.requireNonNull(id, "Shape id cannot be null");
    targetClasses = targetClasses == null ? List.of() : List.copyOf(targetClasses);
    propertyShapes = propertyShapes == null ? List.of() : List.copyOf(propertyShapes);
    ruleConstraints = ruleConstraints == null ? List.of() : List.copyOf(ruleConstraints);
  }

  /**
   * Creates a NodeShape without an implicit class target.
   *
   * @param id the shape identifier
   * @param targetClasses the target classes
   * @param propertyShapes the property shapes
   * @param ruleConstraints the rule constraints
   */
  public NodeShape(Node id, List<Node> targetClasses, List<PropertyShape> propertyShapes,
      List<RuleConstraint> ruleConstraints) {
    this(id, targetClasses, propertyShapes, ruleConstraints, null);
  }
}
