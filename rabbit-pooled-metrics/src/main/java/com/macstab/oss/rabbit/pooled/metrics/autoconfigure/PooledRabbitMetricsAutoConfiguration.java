/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics;
import com.macstab.oss.rabbit.pooled.metrics.micrometer.MicrometerPooledRabbitMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for pooled RabbitMQ metrics.
 *
 * <p><strong>Activation:</strong>
 *
 * <ul>
 *   <li>Micrometer on the classpath and a {@link MeterRegistry} bean present
 *   <li>{@code management.metrics.pooled-rabbit.enabled=true} (default)
 *   <li>No user-defined {@link PooledRabbitMetrics} bean
 * </ul>
 *
 * <p>Otherwise {@link PooledRabbitMetrics#NOOP} is bound, so the starter always finds a bean.
 *
 * <p>Ordered after the actuator's registry auto-configuration (by name, actuator stays optional)
 * so {@code @ConditionalOnBean(MeterRegistry.class)} sees the Boot-managed registry.
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(PooledRabbitMetricsProperties.class)
public class PooledRabbitMetricsAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.pooled-rabbit",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(PooledRabbitMetrics.class)
  public PooledRabbitMetrics micrometerPooledRabbitMetrics(
      final MeterRegistry registry, final PooledRabbitMetricsProperties properties) {
    log.info(
        "Activating pooled RabbitMQ metrics (Micrometer) - connection: '{}', maxCacheSize: {}",
        properties.getConnectionName(),
        properties.getMaxCacheSize());

    return new MicrometerPooledRabbitMetrics(
        registry, properties.getConnectionName(), properties.getMaxCacheSize());
  }

  @Bean
  @ConditionalOnMissingBean(PooledRabbitMetrics.class)
  public PooledRabbitMetrics noOpPooledRabbitMetrics() {
    log.debug("Pooled RabbitMQ metrics disabled - using NOOP singleton");
    return PooledRabbitMetrics.NOOP;
  }
}
