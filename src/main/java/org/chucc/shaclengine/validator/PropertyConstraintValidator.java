package org.chucc.shaclengine.validator;

import java.util.List;
import org.apache.jena.graph.Node;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.ValidationResult;

/**
 * A stateless checker for one family of property shape constraints.
 *
 * <p>Implementations are pure: they only read the graph and return an empty
 * list when none of their constraint fields are set on the shape.</p>
 */
public interface PropertyConstraintValidator {

  /**
   * Validates the values of a focus node against a property shape.
   *
   * @param graph the data graph
   * @param focusNode the node being validated
   * @param shape the property shape
   * @return violations, in constraint order (empty if conformant)
   */
  List<ValidationResult> validate(DataGraph graph, Node focusNode, PropertyShape shape);
}
