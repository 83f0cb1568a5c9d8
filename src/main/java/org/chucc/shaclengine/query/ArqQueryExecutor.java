package org.chucc.shaclengine.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.jena.graph.Node;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryCancelledException;
import org.apache.jena.query.QueryExecutionDatasetBuilder;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.QueryParseException;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.engine.binding.Binding;
import org.chucc.shaclengine.exception.QueryExecutionException;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.graph.JenaDataGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query executor using Apache Jena ARQ engine.
 * Supports SELECT queries against a {@link JenaDataGraph}.
 *
 * <p>A timeout is handed to ARQ, which cancels the query iterators itself.
 * Thread interrupts alone do not stop a running ARQ query.</p>
 */
public class ArqQueryExecutor implements QueryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(ArqQueryExecutor.class);

  @Override
  public List<BindingRow> execute(DataGraph graph, String queryString, Duration timeout) {
    if (!(graph instanceof JenaDataGraph jenaGraph)) {
      throw new QueryExecutionException(
          "ARQ can only query Jena-backed graphs, got " + graph.getClass().getName());
    }

    Query query = parse(queryString);
    if (!query.isSelectType()) {
      throw new QueryExecutionException("Rule queries must be SELECT queries");
    }

    Model model = ModelFactory.createModelForGraph(jenaGraph.getGraph());
    QueryExecutionDatasetBuilder builder = QueryExecution.create()
        .query(query)
        .model(model);
    if (timeout != null) {
      // Rounded up so that ARQ never cancels before the caller's deadline
      long millis = (timeout.toNanos() + 999_999) / 1_000_000;
      builder.timeout(Math.max(1, millis), TimeUnit.MILLISECONDS);
    }
    try (QueryExecution qexec = builder.build()) {
      ResultSet results = qexec.execSelect();
      List<String> variables = results.getResultVars();
      List<BindingRow> rows = new ArrayList<>();
      while (results.hasNext()) {
        rows.add(toRow(results.nextBinding(), variables));
      }
      logger.debug("Rule query returned {} rows", rows.size());
      return rows;
    } catch (QueryCancelledException e) {
      throw new QueryExecutionException("Rule query cancelled: time budget exhausted", e);
    } catch (RuntimeException e) {
      throw new QueryExecutionException("Rule query execution failed: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a query string, translating parse errors.
   *
   * @param queryString the SPARQL query
   * @return the parsed query
   * @throws QueryExecutionException if the query is malformed
   */
  private Query parse(String queryString) {
    try {
      return QueryFactory.create(queryString);
    } catch (QueryParseException e) {
      throw new QueryExecutionException("Malformed rule query: " + e.getMessage(), e);
    }
  }

  private BindingRow toRow(Binding binding, List<String> variables) {
    Map<String, Node> bindings = new LinkedHashMap<>();
    for (String variable : variables) {
      Node value = binding.get(Var.alloc(variable));
      if (value != null) {
        bindings.put(variable, value);
      }
    }
    return new BindingRow(bindings);
  }
}
