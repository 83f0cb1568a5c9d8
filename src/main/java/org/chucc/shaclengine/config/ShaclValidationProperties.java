package org.chucc.shaclengine.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.chucc.shaclengine.engine.ValidationOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for SHACL validation runs.
 *
 * <p>Bound from {@code chucc.shacl.validation.*} and turned into the default
 * {@link ValidationOptions} bean.</p>
 */
@Validated
@ConfigurationProperties(prefix = "chucc.shacl.validation")
public class ShaclValidationProperties {

  /** Timeout value meaning "no per-unit timeout". */
  private static final long NO_TIMEOUT = 0;

  private boolean parallel = false;

  @Min(1)
  private int maxConcurrency = ValidationOptions.defaultConcurrency();

  @Min(0)
  private long timeout = NO_TIMEOUT;

  /**
   * Check if units run on a worker pool.
   *
   * @return true for parallel mode
   */
  public boolean isParallel() {
    return parallel;
  }

  /**
   * Set whether units run on a worker pool.
   *
   * @param parallel true for parallel mode
   */
  public void setParallel(boolean parallel) {
    this.parallel = parallel;
  }

  /**
   * Get maximum number of units in flight (parallel mode).
   *
   * @return maximum concurrent units
   */
  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  /**
   * Set maximum number of units in flight (parallel mode).
   *
   * @param maxConcurrency maximum concurrent units
   */
  public void setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = maxConcurrency;
  }

  /**
   * Get per-unit timeout in milliseconds.
   *
   * @return timeout in milliseconds, 0 for none
   */
  public long getTimeout() {
    return timeout;
  }

  /**
   * Set per-unit timeout in milliseconds.
   *
   * @param timeout timeout in milliseconds, 0 for none
   */
  public void setTimeout(long timeout) {
    this.timeout = timeout;
  }

  /**
   * Converts the properties into run options.
   *
   * @return the validation options
   */
  public ValidationOptions toOptions() {
    Duration unitTimeout = timeout == NO_TIMEOUT ? null : Duration.ofMillis(timeout);
    return new ValidationOptions(parallel, maxConcurrency, unitTimeout);
  }
}
