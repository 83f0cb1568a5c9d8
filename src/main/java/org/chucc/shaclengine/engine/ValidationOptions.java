package org.chucc.shaclengine.engine;

import java.time.Duration;
import org.chucc.shaclengine.exception.InvalidOptionsException;

/**
 * Options for a validation run.
 *
 * <p><b>Execution modes:</b></p>
 * <ul>
 *   <li><b>sequential</b> - units run one after another in a deterministic
 *       order (default)</li>
 *   <li><b>parallel</b> - units run on a bounded worker pool of
 *       {@code maxConcurrency} threads</li>
 * </ul>
 *
 * <p>Options are checked by {@link #validate()} when a run starts, not on
 * construction, so that invalid configuration fails the run itself.</p>
 *
 * @param parallel whether to run units on a worker pool
 * @param maxConcurrency maximum number of units in flight (parallel mode only)
 * @param timeout per-unit timeout, or null for none
 */
public record ValidationOptions(boolean parallel, int maxConcurrency, Duration timeout) {

  /**
   * Default options: sequential, platform parallelism, no timeout.
   *
   * @return the default options
   */
  public static ValidationOptions defaults() {
    return new ValidationOptions(false, defaultConcurrency(), null);
  }

  /**
   * Parallel options with platform parallelism and no timeout.
   *
   * @return parallel options
   */
  public static ValidationOptions parallelDefaults() {
    return new ValidationOptions(true, defaultConcurrency(), null);
  }

  /**
   * Gets the number of available processors.
   *
   * @return the platform parallelism
   */
  public static int defaultConcurrency() {
    return Runtime.getRuntime().availableProcessors();
  }

  public ValidationOptions withParallel(boolean parallel) {
    return new ValidationOptions(parallel, maxConcurrency, timeout);
  }

  public ValidationOptions withMaxConcurrency(int maxConcurrency) {
    return new ValidationOptions(parallel, maxConcurrency, timeout);
  }

  public ValidationOptions withTimeout(Duration timeout) {
    return new ValidationOptions(parallel, maxConcurrency, timeout);
  }

  /**
   * Checks the options.
   *
   * @throws InvalidOptionsException if maxConcurrency is not positive or the
   *     timeout is zero or negative
   */
  public void validate() {
    if (maxConcurrency <= 0) {
      throw new InvalidOptionsException(
          "maxConcurrency must be positive, got " + maxConcurrency);
    }
    if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
      throw new InvalidOptionsException("timeout must be positive, got " + timeout);
    }
  }
}
