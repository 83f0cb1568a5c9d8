package org.chucc.shaclengine.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.jena.graph.Node;
import org.apache.jena.vocabulary.RDF;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.NodeShape;

/**
 * Selects focus nodes for a node shape by class-based targeting.
 *
 * <p>Focus nodes are the subjects of explicit {@code rdf:type} triples for each
 * target class, followed by the instances of the implicit class target. The
 * union is de-duplicated by term equality and keeps discovery order.</p>
 */
public class TargetSelector {

  /**
   * Selects the focus nodes of a shape.
   *
   * @param graph the data graph
   * @param shape the node shape
   * @return focus nodes in discovery order (empty if the shape has no targets)
   */
  public List<Node> select(DataGraph graph, NodeShape shape) {
    Set<Node> focusNodes = new LinkedHashSet<>();
    for (Node targetClass : shape.targetClasses()) {
      focusNodes.addAll(graph.findSubjects(RDF.Nodes.type, targetClass));
    }
    if (shape.implicitClassTarget() != null) {
      focusNodes.addAll(graph.findSubjects(RDF.Nodes.type, shape.implicitClassTarget()));
    }
    return new ArrayList<>(focusNodes);
  }
}
