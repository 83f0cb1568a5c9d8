package org.chucc.shaclengine.validator;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Node;
import org.chucc.shaclengine.exception.QueryExecutionException;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.RuleConstraint;
import org.chucc.shaclengine.model.Severity;
import org.chucc.shaclengine.model.ValidationResult;
import org.chucc.shaclengine.query.BindingRow;
import org.chucc.shaclengine.query.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates rule constraints (SPARQL SELECT queries) for a focus node.
 *
 * <p>Each solution row of a bound query yields exactly one violation whose
 * details are the row's variable bindings. Zero rows means the focus node
 * conforms. Query failures are not converted into "no violation": they are
 * rethrown to the caller.</p>
 *
 * <p>When a deadline is given, every query runs with the time left until that
 * deadline and is cancelled by the query engine once it runs out.</p>
 */
public class RuleConstraintValidator {

  private static final Logger logger = LoggerFactory.getLogger(RuleConstraintValidator.class);

  static final String DEFAULT_MESSAGE = "Rule constraint violated";

  private final QueryExecutor queryExecutor;

  /**
   * Constructs a RuleConstraintValidator.
   *
   * @param queryExecutor the executor for bound queries
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "QueryExecutor is a shared, stateless collaborator")
  public RuleConstraintValidator(QueryExecutor queryExecutor) {
    this.queryExecutor = Objects.requireNonNull(queryExecutor, "QueryExecutor cannot be null");
  }

  /**
   * Validates a focus node against rule constraints.
   *
   * @param graph the data graph
   * @param focusNode the node being validated
   * @param constraints the rule constraints, in evaluation order
   * @param deadline instant by which all queries must finish, or null for none
   * @return one violation per solution row (empty if conformant)
   * @throws QueryExecutionException if any query fails, is cancelled, or the
   *     deadline has passed before it starts
   */
  public List<ValidationResult> validate(DataGraph graph, Node focusNode,
      List<RuleConstraint> constraints, Instant deadline) {
    if (constraints.isEmpty()) {
      return List.of();
    }

    List<ValidationResult> results = new ArrayList<>();
    for (RuleConstraint constraint : constraints) {
      String query = FocusNodeBinder.bind(
          constraint.queryTemplate(), focusNode, constraint.prefixes());
      List<BindingRow> rows = queryExecutor.execute(graph, query, remaining(deadline));
      logger.debug("Rule of shape {} returned {} rows for {}",
          constraint.sourceShapeId(), rows.size(), focusNode);

      String message = constraint.message() != null ? constraint.message() : DEFAULT_MESSAGE;
      for (BindingRow row : rows) {
        Map<String, Object> details = new LinkedHashMap<>(row.bindings());
        results.add(new ValidationResult(
            focusNode,
            null,
            constraint.sourceShapeId(),
            Severity.VIOLATION,
            message,
            details));
      }
    }
    return results;
  }

  private static Duration remaining(Instant deadline) {
    if (deadline == null) {
      return null;
    }
    Duration left = Duration.between(Instant.now(), deadline);
    if (left.isZero() || left.isNegative()) {
      throw new QueryExecutionException("Rule query not started: unit deadline has passed");
    }
    return left;
  }
}
