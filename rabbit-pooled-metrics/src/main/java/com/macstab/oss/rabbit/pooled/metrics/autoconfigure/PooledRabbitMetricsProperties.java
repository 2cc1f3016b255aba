/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.rabbit.pooled.metrics.micrometer.MicrometerPooledRabbitMetrics;

import lombok.Data;

/**
 * Metrics properties, prefix {@code management.metrics.pooled-rabbit}.
 *
 * <pre>
 * management:
 *   metrics:
 *     pooled-rabbit:
 *       enabled: true
 *       connection-name: orders   # match spring.rabbitmq.pooled.connection-name
 *       max-cache-size: 1000
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.pooled-rabbit")
public class PooledRabbitMetricsProperties {

  /** Export Micrometer meters. {@code false} binds {@code PooledRabbitMetrics.NOOP}. */
  private boolean enabled = true;

  /** Connection name whose meters are removed when its manager closes. */
  private String connectionName = "default";

  /** Maximum number of cached meters. */
  private int maxCacheSize = MicrometerPooledRabbitMetrics.DEFAULT_MAX_CACHE_SIZE;
}
