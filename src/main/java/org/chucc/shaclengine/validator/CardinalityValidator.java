package org.chucc.shaclengine.validator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Node;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.ShaclVocabulary;
import org.chucc.shaclengine.model.ValidationResult;

/**
 * Validates sh:minCount and sh:maxCount.
 *
 * <p>Counts every value on the path, duplicates included. Each bound yields at
 * most one violation.</p>
 */
public class CardinalityValidator implements PropertyConstraintValidator {

  @Override
  public List<ValidationResult> validate(DataGraph graph, Node focusNode, PropertyShape shape) {
    if (shape.minCount().isEmpty() && shape.maxCount().isEmpty()) {
      return List.of();
    }

    int count = graph.getValues(focusNode, shape.path()).size();
    List<ValidationResult> results = new ArrayList<>();

    shape.minCount().filter(min -> count < min).ifPresent(min -> {
      Map<String, Object> details = ValidatorSupport.details(ShaclVocabulary.MIN_COUNT_COMPONENT);
      details.put("actual_count", count);
      details.put("min_count", min);
      results.add(ValidatorSupport.violation(focusNode, shape,
          "Property has too few values (expected at least " + min + ", found " + count + ")",
          details));
    });

    shape.maxCount().filter(max -> count > max).ifPresent(max -> {
      Map<String, Object> details = ValidatorSupport.details(ShaclVocabulary.MAX_COUNT_COMPONENT);
      details.put("actual_count", count);
      details.put("max_count", max);
      results.add(ValidatorSupport.violation(focusNode, shape,
          "Property has too many values (expected at most " + max + ", found " + count + ")",
          details));
    });

    return results;
  }
}
