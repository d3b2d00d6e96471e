package eventstore.spring.boot;

import eventstore.micrometer.MicrometerMetricsExporter;
import eventstore.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

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
 * and {@code eventstore.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link EventStoreAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the EventStore composite, which closes it.
 */
@AutoConfiguration(before = EventStoreAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "eventstore.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EventStoreProperties.class)
public class EventStoreMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, EventStoreProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
