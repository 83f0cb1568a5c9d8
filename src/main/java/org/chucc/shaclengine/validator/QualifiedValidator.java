package org.chucc.shaclengine.validator;

import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Node;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.ShaclVocabulary;
import org.chucc.shaclengine.model.ValidationResult;

/**
 * Validates sh:qualifiedValueShape (restricted to a single class filter) with
 * sh:qualifiedMinCount.
 *
 * <p>Only values explicitly typed with the qualified class are counted. The
 * check needs both the class and the minimum count; with either missing it does
 * nothing.</p>
 */
public class QualifiedValidator implements PropertyConstraintValidator {

  @Override
  public List<ValidationResult> validate(DataGraph graph, Node focusNode, PropertyShape shape) {
    if (shape.qualifiedClass().isEmpty() || shape.qualifiedMinCount().isEmpty()) {
      return List.of();
    }

    Node qualifiedClass = shape.qualifiedClass().get();
    int minCount = shape.qualifiedMinCount().get();
    List<Node> values = graph.getValues(focusNode, shape.path());
    long qualifiedCount = values.stream()
        .filter(value -> ValidatorSupport.isInstanceOf(graph, value, qualifiedClass))
        .count();

    if (qualifiedCount >= minCount) {
      return List.of();
    }

    Map<String, Object> details =
        ValidatorSupport.details(ShaclVocabulary.QUALIFIED_MIN_COUNT_COMPONENT);
    details.put("qualified_count", (int) qualifiedCount);
    details.put("qualified_min_count", minCount);
    details.put("qualified_class", qualifiedClass);
    details.put("total_values", values.size());
    return List.of(ValidatorSupport.violation(focusNode, shape,
        "Property has too few values of required type (expected at least " + minCount
            + " instances of " + ValidatorSupport.format(qualifiedClass)
            + ", found " + qualifiedCount + ")",
        details));
  }
}
