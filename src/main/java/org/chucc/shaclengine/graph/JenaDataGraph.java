package org.chucc.shaclengine.graph;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Objects;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;

/**
 * {@link DataGraph} backed by an Apache Jena {@link Graph}.
 *
 * <p>Concurrent reads are safe as long as nobody writes to the wrapped graph
 * while a validation run is in progress.</p>
 */
public class JenaDataGraph implements DataGraph {

  private final Graph graph;

  /**
   * Wraps a Jena graph.
   *
   * @param graph the graph to read from
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The wrapped graph is shared and only read")
  public JenaDataGraph(Graph graph) {
    this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
  }

  /**
   * Gets the wrapped Jena graph (used by the ARQ query executor).
   *
   * @return the underlying graph
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Query execution needs the underlying graph")
  public Graph getGraph() {
    return graph;
  }

  @Override
  public List<Node> getValues(Node subject, Node predicate) {
    return graph.find(subject, predicate, Node.ANY)
        .mapWith(Triple::getObject)
        .toList();
  }

  @Override
  public boolean hasTriple(Node subject, Node predicate, Node object) {
    return graph.contains(subject, predicate, object);
  }

  @Override
  public List<Node> findSubjects(Node predicate, Node object) {
    return graph.find(Node.ANY, predicate, object)
        .mapWith(Triple::getSubject)
        .toList();
  }
}
