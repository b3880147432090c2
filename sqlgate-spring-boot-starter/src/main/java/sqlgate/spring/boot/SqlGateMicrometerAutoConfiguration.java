package sqlgate.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import sqlgate.micrometer.MicrometerMetricsExporter;
import sqlgate.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code sqlgate.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link SqlGateAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@code SqlGate}.
 */
@AutoConfiguration(before = SqlGateAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "sqlgate.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SqlGateProperties.class)
public class SqlGateMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, SqlGateProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
