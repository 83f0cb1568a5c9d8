package org.chucc.shaclengine.query;

import java.time.Duration;
import java.util.List;
import org.chucc.shaclengine.exception.QueryExecutionException;
import org.chucc.shaclengine.graph.DataGraph;

/**
 * Executes bound rule queries against a data graph.
 *
 * <p>Implementations must be safe to call concurrently from several validation
 * units.</p>
 */
public interface QueryExecutor {

  /**
   * Executes a SELECT query.
   *
   * @param graph the data graph to query
   * @param query the query string, with {@code $this} already substituted
   * @param timeout time the query may run before it is cancelled, or null for none
   * @return the solution rows (empty if none)
   * @throws QueryExecutionException if the query cannot be parsed, is cancelled
   *     or fails
   */
  List<BindingRow> execute(DataGraph graph, String query, Duration timeout);
}
