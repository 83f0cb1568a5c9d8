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
 * Validates sh:datatype and sh:class.
 *
 * <p>Class membership only honors explicit rdf:type triples; no subclass
 * reasoning is performed. One violation is produced per offending value.</p>
 */
public class TypeValidator implements PropertyConstraintValidator {

  @Override
  public List<ValidationResult> validate(DataGraph graph, Node focusNode, PropertyShape shape) {
    if (shape.datatype().isEmpty() && shape.shClass().isEmpty()) {
      return List.of();
    }

    List<Node> values = graph.getValues(focusNode, shape.path());
    List<ValidationResult> results = new ArrayList<>();

    shape.datatype().ifPresent(datatype -> {
      for (Node value : values) {
        if (!hasDatatype(value, datatype)) {
          Map<String, Object> details =
              ValidatorSupport.details(ShaclVocabulary.DATATYPE_COMPONENT);
          details.put(ValidatorSupport.VALUE, value);
          details.put("datatype", datatype);
          results.add(ValidatorSupport.violation(focusNode, shape,
              "Value does not have required datatype " + ValidatorSupport.format(datatype),
              details));
        }
      }
    });

    shape.shClass().ifPresent(shClass -> {
      for (Node value : values) {
        if (!ValidatorSupport.isInstanceOf(graph, value, shClass)) {
          Map<String, Object> details = ValidatorSupport.details(ShaclVocabulary.CLASS_COMPONENT);
          details.put(ValidatorSupport.VALUE, value);
          details.put("class", shClass);
          results.add(ValidatorSupport.violation(focusNode, shape,
              "Value is not an instance of class " + ValidatorSupport.format(shClass),
              details));
        }
      }
    });

    return results;
  }

  private static boolean hasDatatype(Node value, Node datatype) {
    return value.isLiteral() && datatype.getURI().equals(value.getLiteralDatatypeURI());
  }
}
