package org.chucc.shaclengine.model;

import org.apache.jena.graph.Node;

/**
 * Severity of a validation result.
 *
 * <p>{@link #ENGINE_ERROR} marks an infrastructure failure while evaluating a
 * unit of work. It has no SHACL counterpart and never affects conformance.</p>
 */
public enum Severity {
  VIOLATION(ShaclVocabulary.VIOLATION),
  WARNING(ShaclVocabulary.WARNING),
  INFO(ShaclVocabulary.INFO),
  ENGINE_ERROR(null);

  private final Node iri;

  Severity(Node iri) {
    this.iri = iri;
  }

  /**
   * Gets the sh: severity IRI.
   *
   * @return the severity IRI, or null for {@link #ENGINE_ERROR}
   */
  public Node iri() {
    return iri;
  }
}
