package org.chucc.shaclengine.validator;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.jena.graph.Node;
import org.apache.jena.sparql.util.FmtUtils;
import org.apache.jena.vocabulary.RDF;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.Severity;
import org.chucc.shaclengine.model.ValidationResult;

/**
 * Shared helpers for the property constraint validators.
 */
final class ValidatorSupport {

  static final String CONSTRAINT_COMPONENT = "constraint_component";
  static final String VALUE = "value";

  private ValidatorSupport() {
    // Utility class - prevent instantiation
  }

  /**
   * Builds a violation for a property shape. The shape's own message, when
   * present, replaces the default message verbatim.
   *
   * @param focusNode the focus node
   * @param shape the violated property shape
   * @param defaultMessage message used when the shape has none
   * @param details result details
   * @return the violation
   */
  static ValidationResult violation(Node focusNode, PropertyShape shape,
      String defaultMessage, Map<String, Object> details) {
    return new ValidationResult(
        focusNode,
        shape.path(),
        shape.id(),
        Severity.VIOLATION,
        shape.message().orElse(defaultMessage),
        details);
  }

  /**
   * Starts a details map for the given constraint component.
   *
   * @param component the sh: constraint component IRI
   * @return a mutable, ordered details map
   */
  static Map<String, Object> details(Node component) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put(CONSTRAINT_COMPONENT, component);
    return details;
  }

  /**
   * Checks for an explicit rdf:type assertion. Literals are never instances.
   *
   * @param graph the data graph
   * @param value the term to check
   * @param classIri the class IRI
   * @return true if the graph contains (value rdf:type classIri)
   */
  static boolean isInstanceOf(DataGraph graph, Node value, Node classIri) {
    if (value.isLiteral()) {
      return false;
    }
    return graph.hasTriple(value, RDF.Nodes.type, classIri);
  }

  /**
   * Parses the lexical form of a literal as a decimal number.
   *
   * @param value the term
   * @return the number, or empty for non-literals and non-numeric lexical forms
   */
  static Optional<BigDecimal> parseNumber(Node value) {
    if (!value.isLiteral()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new BigDecimal(value.getLiteralLexicalForm().strip()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  /**
   * Formats a term for use in a message.
   *
   * @param node the term
   * @return the term in SPARQL syntax
   */
  static String format(Node node) {
    return FmtUtils.stringForNode(node);
  }
}
