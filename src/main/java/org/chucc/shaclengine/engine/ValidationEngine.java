package org.chucc.shaclengine.engine;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Node;
import org.chucc.shaclengine.exception.InvalidOptionsException;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.NodeShape;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.Severity;
import org.chucc.shaclengine.model.ValidationReport;
import org.chucc.shaclengine.model.ValidationResult;
import org.chucc.shaclengine.query.QueryExecutor;
import org.chucc.shaclengine.validator.CardinalityValidator;
import org.chucc.shaclengine.validator.PropertyConstraintValidator;
import org.chucc.shaclengine.validator.QualifiedValidator;
import org.chucc.shaclengine.validator.RuleConstraintValidator;
import org.chucc.shaclengine.validator.StringValidator;
import org.chucc.shaclengine.validator.TypeValidator;
import org.chucc.shaclengine.validator.ValueValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a data graph against a list of node shapes.
 *
 * <p><b>Run phases:</b></p>
 * <ol>
 *   <li>Target selection - focus nodes per node shape</li>
 *   <li>Dispatch - one unit per (node shape, focus node); every property shape
 *       runs through the cardinality, type, string, value and qualified
 *       validators, then the node shape's rule constraints run</li>
 *   <li>Aggregation - unit results concatenated in shape order, focus-node
 *       order, property-shape order, validator order, rules last</li>
 * </ol>
 *
 * <p><b>Failure isolation:</b> a unit that throws or times out becomes one
 * {@link Severity#ENGINE_ERROR} result and never aborts the run. Only invalid
 * options (and fatal virtual machine errors) fail a run. A timed-out unit is
 * stopped: its rule queries run under the unit's deadline and pattern matching
 * honours the worker interrupt.</p>
 *
 * <p>Each call to {@link #run} is self-contained; the engine holds no state
 * between runs and never writes to the data graph.</p>
 */
public class ValidationEngine {

  private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

  private final List<PropertyConstraintValidator> propertyValidators = List.of(
      new CardinalityValidator(),
      new TypeValidator(),
      new StringValidator(),
      new ValueValidator(),
      new QualifiedValidator());

  private final TargetSelector targetSelector = new TargetSelector();
  private final RuleConstraintValidator ruleValidator;
  private final MeterRegistry meterRegistry;

  /**
   * Constructs a ValidationEngine with a private meter registry.
   *
   * @param queryExecutor the executor for rule constraint queries
   */
  public ValidationEngine(QueryExecutor queryExecutor) {
    this(queryExecutor, new SimpleMeterRegistry());
  }

  /**
   * Constructs a ValidationEngine.
   *
   * @param queryExecutor the executor for rule constraint queries
   * @param meterRegistry the meter registry for metrics
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "QueryExecutor and MeterRegistry are shared collaborators")
  public ValidationEngine(QueryExecutor queryExecutor, MeterRegistry meterRegistry) {
    this.ruleValidator = new RuleConstraintValidator(queryExecutor);
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry cannot be null");
  }

  /**
   * Validates with default options (sequential, no timeout).
   *
   * @param graph the data graph
   * @param shapes the node shapes
   * @return the validation report
   */
  public ValidationReport run(DataGraph graph, List<NodeShape> shapes) {
    return run(graph, shapes, ValidationOptions.defaults());
  }

  /**
   * Validates a data graph against node shapes.
   *
   * @param graph the data graph (read only)
   * @param shapes the node shapes, in aggregation order
   * @param options the run options
   * @return the validation report
   * @throws InvalidOptionsException if the options are invalid
   */
  public ValidationReport run(DataGraph graph, List<NodeShape> shapes,
      ValidationOptions options) {
    Objects.requireNonNull(graph, "Data graph cannot be null");
    Objects.requireNonNull(shapes, "Shapes cannot be null");
    Objects.requireNonNull(options, "Options cannot be null");
    options.validate();

    String mode = options.parallel() ? "parallel" : "sequential";
    Timer.Sample sample = Timer.start(meterRegistry);
    long startNanos = System.nanoTime();

    List<ValidationUnit> units = selectUnits(graph, shapes);
    logger.info("Validating {} units from {} node shapes ({} mode)",
        units.size(), shapes.size(), mode);

    UnitRunner runner = new UnitRunner((unit, deadline) -> evaluate(graph, unit, deadline));
    Duration timeout = options.timeout();
    List<List<ValidationResult>> unitResults;
    if (options.parallel()) {
      unitResults = runner.runOnPool(units, options.maxConcurrency(), timeout);
    } else if (timeout != null) {
      unitResults = runner.runOnPool(units, 1, timeout);
    } else {
      unitResults = runner.runInline(units);
    }

    List<ValidationResult> results = new ArrayList<>();
    unitResults.forEach(results::addAll);
    ValidationReport report = new ValidationReport(results);

    sample.stop(Timer.builder("shacl.validation.run")
        .description("Validation run duration")
        .tag("mode", mode)
        .register(meterRegistry));
    recordResults(report);

    long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
    logger.info("Validation finished in {} ms: conforms={}, results={}, engine errors={}",
        elapsedMs, report.conforms(), results.size(), report.getEngineErrors().size());
    if (report.isInconclusive()) {
      logger.warn("Report conforms only under partial coverage: {} units failed",
          report.getEngineErrors().size());
    }
    return report;
  }

  /**
   * Builds the units for all shapes, in shape order then focus-node order.
   */
  private List<ValidationUnit> selectUnits(DataGraph graph, List<NodeShape> shapes) {
    List<ValidationUnit> units = new ArrayList<>();
    for (NodeShape shape : shapes) {
      List<Node> focusNodes = targetSelector.select(graph, shape);
      logger.debug("Shape {} selected {} focus nodes", shape.id(), focusNodes.size());
      for (Node focusNode : focusNodes) {
        units.add(new ValidationUnit(shape, focusNode));
      }
    }
    return units;
  }

  /**
   * Evaluates one unit: property shapes through every core validator, then
   * the rule constraints.
   *
   * @param graph the data graph
   * @param unit the unit
   * @param deadline instant by which rule queries must finish, or null for none
   * @return the unit's results, in aggregation order
   */
  List<ValidationResult> evaluate(DataGraph graph, ValidationUnit unit, Instant deadline) {
    List<ValidationResult> results = new ArrayList<>();
    Node focusNode = unit.focusNode();
    for (PropertyShape propertyShape : unit.shape().propertyShapes()) {
      for (PropertyConstraintValidator validator : propertyValidators) {
        results.addAll(validator.validate(graph, focusNode, propertyShape));
      }
    }
    results.addAll(ruleValidator.validate(
        graph, focusNode, unit.shape().ruleConstraints(), deadline));
    return results;
  }

  private void recordResults(ValidationReport report) {
    for (Map.Entry<Severity, Long> entry : report.countBySeverity().entrySet()) {
      if (entry.getValue() > 0) {
        Counter.builder("shacl.validation.results")
            .description("Validation results by severity")
            .tag("severity", entry.getKey().name().toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment(entry.getValue());
      }
    }
    for (ValidationResult error : report.getEngineErrors()) {
      Counter.builder("shacl.validation.unit.failures")
          .description("Validation units that failed or timed out")
          .tag("reason", String.valueOf(error.details().get(EngineErrors.ERROR_CODE)))
          .register(meterRegistry)
          .increment();
    }
  }
}
