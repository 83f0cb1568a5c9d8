package org.chucc.shaclengine.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of validating a data graph against a list of node shapes.
 *
 * <p>Conformance is derived from the results on every call: a report conforms
 * iff it contains no {@link Severity#VIOLATION} result. Warnings, infos and
 * engine errors do not affect conformance.</p>
 *
 * <p><b>Coverage:</b> engine errors mean some units were not fully evaluated.
 * A report that conforms but carries engine errors is inconclusive, not a clean
 * pass. Use {@link #isFullyConformant()} to require both.</p>
 */
public final class ValidationReport {

  private final List<ValidationResult> results;

  /**
   * Creates a report over the given results.
   *
   * @param results the results, in aggregation order
   */
  public ValidationReport(List<ValidationResult> results) {
    Objects.requireNonNull(results, "Results cannot be null");
    this.results = List.copyOf(results);
  }

  /**
   * Creates an empty, conforming report.
   *
   * @return an empty report
   */
  public static ValidationReport empty() {
    return new ValidationReport(List.of());
  }

  public List<ValidationResult> getResults() {
    return results;
  }

  /**
   * Checks whether the data graph conforms (no violations).
   *
   * @return true if no result has severity VIOLATION
   */
  public boolean conforms() {
    return results.stream().noneMatch(ValidationResult::isViolation);
  }

  /**
   * Checks whether the report conforms only under partial coverage.
   *
   * @return true if there are no violations but at least one engine error
   */
  public boolean isInconclusive() {
    return conforms() && hasEngineErrors();
  }

  /**
   * Checks for full conformance with full coverage.
   *
   * @return true if there are no violations and no engine errors
   */
  public boolean isFullyConformant() {
    return conforms() && !hasEngineErrors();
  }

  public boolean hasEngineErrors() {
    return results.stream().anyMatch(r -> r.severity() == Severity.ENGINE_ERROR);
  }

  public List<ValidationResult> getViolations() {
    return bySeverity(Severity.VIOLATION);
  }

  public List<ValidationResult> getWarnings() {
    return bySeverity(Severity.WARNING);
  }

  public List<ValidationResult> getInfos() {
    return bySeverity(Severity.INFO);
  }

  public List<ValidationResult> getEngineErrors() {
    return bySeverity(Severity.ENGINE_ERROR);
  }

  /**
   * Counts results per severity. Every severity is present in the map.
   *
   * @return counts keyed by severity
   */
  public Map<Severity, Long> countBySeverity() {
    Map<Severity, Long> counts = new EnumMap<>(Severity.class);
    for (Severity severity : Severity.values()) {
      counts.put(severity, 0L);
    }
    for (ValidationResult result : results) {
      counts.merge(result.severity(), 1L, Long::sum);
    }
    return counts;
  }

  private List<ValidationResult> bySeverity(Severity severity) {
    return results.stream()
        .filter(r -> r.severity() == severity)
        .toList();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return results.equals(((ValidationReport) obj).results);
  }

  @Override
  public int hashCode() {
    return results.hashCode();
  }

  @Override
  public String toString() {
    return "ValidationReport{conforms=" + conforms() + ", results=" + results.size() + "}";
  }
}
