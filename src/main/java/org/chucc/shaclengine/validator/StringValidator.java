package org.chucc.shaclengine.validator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.jena.graph.Node;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.ShaclVocabulary;
import org.chucc.shaclengine.model.ValidationResult;

/**
 * Validates sh:pattern and sh:minLength against the lexical form of literal
 * values. IRIs and blank nodes always violate both constraints.
 *
 * <p>Patterns must match the whole lexical form. Lengths are counted in
 * Unicode code points. Matching stops with an exception when the worker
 * thread is interrupted.</p>
 */
public class StringValidator implements PropertyConstraintValidator {

  @Override
  public List<ValidationResult> validate(DataGraph graph, Node focusNode, PropertyShape shape) {
    if (shape.pattern().isEmpty() && shape.minLength().isEmpty()) {
      return List.of();
    }

    List<Node> values = graph.getValues(focusNode, shape.path());
    List<ValidationResult> results = new ArrayList<>();

    shape.pattern().ifPresent(pattern -> {
      for (Node value : values) {
        if (!value.isLiteral() || !matches(pattern, value.getLiteralLexicalForm())) {
          Map<String, Object> details = ValidatorSupport.details(ShaclVocabulary.PATTERN_COMPONENT);
          details.put(ValidatorSupport.VALUE, value);
          details.put("pattern", pattern.pattern());
          results.add(ValidatorSupport.violation(focusNode, shape,
              "Value does not match required pattern \"" + pattern.pattern() + "\"",
              details));
        }
      }
    });

    shape.minLength().ifPresent(minLength -> {
      for (Node value : values) {
        int length = value.isLiteral() ? codePointLength(value.getLiteralLexicalForm()) : -1;
        if (length < minLength) {
          Map<String, Object> details =
              ValidatorSupport.details(ShaclVocabulary.MIN_LENGTH_COMPONENT);
          details.put(ValidatorSupport.VALUE, value);
          details.put("min_length", minLength);
          String message;
          if (length < 0) {
            message = "Value is not a literal and has no length";
          } else {
            details.put("actual_length", length);
            message = "Value is too short (expected at least " + minLength
                + " characters, found " + length + ")";
          }
          results.add(ValidatorSupport.violation(focusNode, shape, message, details));
        }
      }
    });

    return results;
  }

  private static boolean matches(Pattern pattern, String lexical) {
    return pattern.matcher(new InterruptibleCharSequence(lexical)).matches();
  }

  private static int codePointLength(String lexical) {
    return lexical.codePointCount(0, lexical.length());
  }
}
