package org.chucc.shaclengine.graph;

import java.util.List;
import org.apache.jena.graph.Node;

/**
 * Read-only view of the data graph being validated.
 *
 * <p>Implementations must be safe for concurrent reads. The validation engine
 * never writes to the graph.</p>
 */
public interface DataGraph {

  /**
   * Gets all objects of triples with the given subject and predicate.
   *
   * @param subject the subject
   * @param predicate the predicate
   * @return the objects in backing-store order (empty if none)
   */
  List<Node> getValues(Node subject, Node predicate);

  /**
   * Checks whether the graph contains the given triple.
   *
   * @param subject the subject
   * @param predicate the predicate
   * @param object the object
   * @return true if the triple is present
   */
  boolean hasTriple(Node subject, Node predicate, Node object);

  /**
   * Gets all subjects of triples with the given predicate and object.
   *
   * @param predicate the predicate
   * @param object the object
   * @return the subjects in backing-store order (empty if none)
   */
  List<Node> findSubjects(Node predicate, Node object);
}
