package org.chucc.shaclengine.validator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.jena.graph.Node;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.ShaclVocabulary;
import org.chucc.shaclengine.model.ValidationResult;

/**
 * Validates sh:in, sh:hasValue and sh:maxInclusive.
 *
 * <p>Value comparisons use term equality: same IRI, same blank node label, or
 * same lexical form, datatype and language tag. Only sh:maxInclusive interprets
 * lexical forms as numbers.</p>
 */
public class ValueValidator implements PropertyConstraintValidator {

  @Override
  public List<ValidationResult> validate(DataGraph graph, Node focusNode, PropertyShape shape) {
    if (shape.inList().isEmpty() && shape.hasValue().isEmpty()
        && shape.maxInclusive().isEmpty()) {
      return List.of();
    }

    List<Node> values = graph.getValues(focusNode, shape.path());
    List<ValidationResult> results = new ArrayList<>();
    checkIn(focusNode, shape, values, results);
    checkHasValue(focusNode, shape, values, results);
    checkMaxInclusive(focusNode, shape, values, results);
    return results;
  }

  private void checkIn(Node focusNode, PropertyShape shape, List<Node> values,
      List<ValidationResult> results) {
    List<Node> allowed = shape.inList();
    if (allowed.isEmpty()) {
      return;
    }
    for (Node value : values) {
      if (!allowed.contains(value)) {
        Map<String, Object> details = ValidatorSupport.details(ShaclVocabulary.IN_COMPONENT);
        details.put(ValidatorSupport.VALUE, value);
        details.put("allowed_values", allowed);
        results.add(ValidatorSupport.violation(focusNode, shape,
            "Value is not one of the allowed values", details));
      }
    }
  }

  private void checkHasValue(Node focusNode, PropertyShape shape, List<Node> values,
      List<ValidationResult> results) {
    Optional<Node> required = shape.hasValue();
    if (required.isEmpty() || values.contains(required.get())) {
      return;
    }
    Map<String, Object> details = ValidatorSupport.details(ShaclVocabulary.HAS_VALUE_COMPONENT);
    details.put("required_value", required.get());
    results.add(ValidatorSupport.violation(focusNode, shape,
        "Required value " + ValidatorSupport.format(required.get()) + " is missing", details));
  }

  private void checkMaxInclusive(Node focusNode, PropertyShape shape, List<Node> values,
      List<ValidationResult> results) {
    Optional<BigDecimal> bound = shape.maxInclusive();
    if (bound.isEmpty()) {
      return;
    }
    BigDecimal max = bound.get();
    for (Node value : values) {
      Optional<BigDecimal> number = ValidatorSupport.parseNumber(value);
      if (number.isPresent() && number.get().compareTo(max) <= 0) {
        continue;
      }
      Map<String, Object> details =
          ValidatorSupport.details(ShaclVocabulary.MAX_INCLUSIVE_COMPONENT);
      details.put(ValidatorSupport.VALUE, value);
      details.put("max_inclusive", max);
      String message = number
          .map(n -> "Value exceeds maximum (expected <= " + max.toPlainString()
              + ", found " + n.toPlainString() + ")")
          .orElse("Value is not numeric (expected a number <= " + max.toPlainString() + ")");
      results.add(ValidatorSupport.violation(focusNode, shape, message, details));
    }
  }
}
