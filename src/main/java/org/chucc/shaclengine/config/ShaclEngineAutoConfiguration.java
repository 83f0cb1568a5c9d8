package org.chucc.shaclengine.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.chucc.shaclengine.engine.ValidationEngine;
import org.chucc.shaclengine.engine.ValidationOptions;
import org.chucc.shaclengine.query.ArqQueryExecutor;
import org.chucc.shaclengine.query.QueryExecutor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the validation engine.
 *
 * <p>Every bean backs off when the application defines its own. Metrics go to
 * the application's {@link MeterRegistry} when one exists.</p>
 */
@AutoConfiguration
@EnableConfigurationProperties(ShaclValidationProperties.class)
public class ShaclEngineAutoConfiguration {

  /**
   * Query executor for rule constraints, backed by Jena ARQ.
   *
   * @return the query executor
   */
  @Bean
  @ConditionalOnMissingBean
  public QueryExecutor shaclQueryExecutor() {
    return new ArqQueryExecutor();
  }

  /**
   * The validation engine.
   *
   * @param queryExecutor the rule query executor
   * @param meterRegistry the application meter registry, if any
   * @return the validation engine
   */
  @Bean
  @ConditionalOnMissingBean
  public ValidationEngine validationEngine(QueryExecutor queryExecutor,
      ObjectProvider<MeterRegistry> meterRegistry) {
    return new ValidationEngine(queryExecutor,
        meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  /**
   * Default run options from configuration properties.
   *
   * @param properties the validation properties
   * @return the default validation options
   */
  @Bean
  @ConditionalOnMissingBean
  public ValidationOptions validationOptions(ShaclValidationProperties properties) {
    return properties.toOptions();
  }
}
