package org.chucc.shaclengine.model;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * SHACL vocabulary terms used in validation results.
 */
public final class ShaclVocabulary {

  public static final String NS = "http://www.w3.org/ns/shacl#";

  public static final Node VIOLATION = iri("Violation");
  public static final Node WARNING = iri("Warning");
  public static final Node INFO = iri("Info");

  public static final Node MIN_COUNT_COMPONENT = iri("MinCountConstraintComponent");
  public static final Node MAX_COUNT_COMPONENT = iri("MaxCountConstraintComponent");
  public static final Node DATATYPE_COMPONENT = iri("DatatypeConstraintComponent");
  public static final Node CLASS_COMPONENT = iri("ClassConstraintComponent");
  public static final Node PATTERN_COMPONENT = iri("PatternConstraintComponent");
  public static final Node MIN_LENGTH_COMPONENT = iri("MinLengthConstraintComponent");
  public static final Node IN_COMPONENT = iri("InConstraintComponent");
  public static final Node HAS_VALUE_COMPONENT = iri("HasValueConstraintComponent");
  public static final Node MAX_INCLUSIVE_COMPONENT = iri("MaxInclusiveConstraintComponent");
  public static final Node QUALIFIED_MIN_COUNT_COMPONENT =
      iri("QualifiedMinCountConstraintComponent");
  public static final Node SPARQL_COMPONENT = iri("SPARQLConstraintComponent");

  private ShaclVocabulary() {
    // Utility class - prevent instantiation
  }

  private static Node iri(String localName) {
    return NodeFactory.createURI(NS + localName);
  }
}
