package org.chucc.shaclengine.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.chucc.shaclengine.testutil.TestConstants.N1;
import static org.chucc.shaclengine.testutil.TestConstants.N2;
import static org.chucc.shaclengine.testutil.TestConstants.NAME;
import static org.chucc.shaclengine.testutil.TestConstants.P;
import static org.chucc.shaclengine.testutil.TestConstants.graph;
import static org.chucc.shaclengine.testutil.TestConstants.iri;
import static org.chucc.shaclengine.testutil.TestConstants.string;
import static org.chucc.shaclengine.testutil.TestConstants.triple;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.List;
import org.apache.jena.graph.Triple;
import org.chucc.shaclengine.exception.QueryExecutionException;
import org.chucc.shaclengine.graph.DataGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ArqQueryExecutor.
 */
class ArqQueryExecutorTest {

  /** Three-way cross product whose filter needs every variable, so nothing prunes early. */
  static final String CROSS_PRODUCT_QUERY = "SELECT ?a WHERE { "
      + "?a <http://example.org/p> ?x . ?b <http://example.org/p> ?y . "
      + "?c <http://example.org/p> ?z . "
      + "FILTER(STR(?x) = CONCAT(STR(?y), STR(?z), \"-\")) }";

  private ArqQueryExecutor executor;
  private DataGraph graph;

  @BeforeEach
  void setUp() {
    executor = new ArqQueryExecutor();
    graph = graph(
        triple(N1, NAME, string("alpha")),
        triple(N1, NAME, string("beta")),
        triple(N2, NAME, string("gamma")));
  }

  @Test
  void execute_shouldReturnRowsInProjectionOrder() {
    // When
    List<BindingRow> rows = executor.execute(graph,
        "SELECT ?name ?s WHERE { ?s <http://example.org/name> ?name } ORDER BY ?name", null);

    // Then
    assertThat(rows).hasSize(3);
    assertThat(rows.get(0).bindings().keySet()).containsExactly("name", "s");
    assertThat(rows).extracting(row -> row.get("name"))
        .containsExactly(string("alpha"), string("beta"), string("gamma"));
  }

  @Test
  void execute_shouldReturnEmpty_whenNoSolutions() {
    List<BindingRow> rows = executor.execute(graph,
        "SELECT ?x WHERE { <http://example.org/n3> <http://example.org/name> ?x }", null);

    assertThat(rows).isEmpty();
  }

  @Test
  void execute_shouldOmitUnboundVariables() {
    List<BindingRow> rows = executor.execute(graph,
        "SELECT ?name ?missing WHERE { <http://example.org/n2> <http://example.org/name> ?name "
            + "OPTIONAL { ?name <http://example.org/p> ?missing } }", null);

    assertThat(rows).singleElement()
        .satisfies(row -> {
          assertThat(row.get("name")).isEqualTo(string("gamma"));
          assertThat(row.bindings()).doesNotContainKey("missing");
        });
  }

  @Test
  void execute_shouldAcceptBoundProjection() {
    List<BindingRow> rows = executor.execute(graph,
        "SELECT ?this ?name WHERE { BIND(<http://example.org/n2> AS ?this) . "
            + "<http://example.org/n2> <http://example.org/name> ?name }", null);

    assertThat(rows).singleElement()
        .satisfies(row -> assertThat(row.get("this")).isEqualTo(N2));
  }

  @Test
  void execute_shouldReturnRows_whenWithinTimeout() {
    List<BindingRow> rows = executor.execute(graph,
        "SELECT ?name WHERE { <http://example.org/n1> <http://example.org/name> ?name }",
        Duration.ofSeconds(30));

    assertThat(rows).hasSize(2);
  }

  @Test
  void execute_shouldCancelQuery_whenTimeoutExpires() {
    // Given
    DataGraph large = largeGraph(300);

    // When
    long start = System.nanoTime();
    assertThatThrownBy(() -> executor.execute(large, CROSS_PRODUCT_QUERY, Duration.ofMillis(200)))
        .isInstanceOf(QueryExecutionException.class)
        .hasMessageContaining("cancelled");
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

    // Then
    assertThat(elapsed).isLessThan(Duration.ofSeconds(3));
  }

  @Test
  void execute_shouldThrow_whenQueryMalformed() {
    assertThatThrownBy(() -> executor.execute(graph, "SELECT ?x WHERE { ?x ", null))
        .isInstanceOf(QueryExecutionException.class)
        .hasMessageStartingWith("Malformed rule query")
        .extracting("code")
        .isEqualTo("query_error");
  }

  @Test
  void execute_shouldThrow_whenQueryIsNotSelect() {
    assertThatThrownBy(() -> executor.execute(graph, "ASK { ?s ?p ?o }", null))
        .isInstanceOf(QueryExecutionException.class)
        .hasMessage("Rule queries must be SELECT queries");
  }

  @Test
  void execute_shouldThrow_whenGraphIsNotJenaBacked() {
    DataGraph foreign = mock(DataGraph.class);

    assertThatThrownBy(() -> executor.execute(foreign, "SELECT ?s WHERE { ?s ?p ?o }", null))
        .isInstanceOf(QueryExecutionException.class)
        .hasMessageContaining("Jena-backed");
  }

  /**
   * Builds a graph with {@code size} triples on the predicate ex:p.
   */
  static DataGraph largeGraph(int size) {
    Triple[] triples = new Triple[size];
    for (int i = 0; i < size; i++) {
      triples[i] = triple(iri("s" + i), P, string("v" + i));
    }
    return graph(triples);
  }
}
