/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.metrics.micrometer;

import static com.macstab.oss.rabbit.pooled.metrics.micrometer.MetricsConfiguration.*;

import java.util.concurrent.TimeUnit;

import com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link PooledRabbitMetrics}.
 *
 * <p><strong>Meters</strong> (see {@link MetricsConfiguration}):
 *
 * <ul>
 *   <li>{@code rabbitmq.pooled.resources.created} counter, per pool
 *   <li>{@code rabbitmq.pooled.resources.creation.failures} counter, per pool
 *   <li>{@code rabbitmq.pooled.acquire.wait} timer, per pool
 *   <li>{@code rabbitmq.pooled.pool.live} / {@code .pool.idle} gauges, per pool
 *   <li>{@code rabbitmq.pooled.queue.channels} gauge
 * </ul>
 *
 * <p><strong>Lifecycle:</strong> {@link #close(String)} for this instance's connection name
 * removes its meters from the registry; later recordings are dropped. Idempotent.
 *
 * <p><strong>Example PromQL:</strong>
 *
 * <pre>
 * # mean time to get a channel
 * rate(rabbitmq_pooled_acquire_wait_seconds_sum{pool_name="channels"}[5m])
 *   / rate(rabbitmq_pooled_acquire_wait_seconds_count{pool_name="channels"}[5m])
 *
 * # channels currently lent or adopted
 * rabbitmq_pooled_pool_live{pool_name="channels"}
 *   - rabbitmq_pooled_pool_idle{pool_name="channels"}
 * </pre>
 */
@Slf4j
public final class MicrometerPooledRabbitMetrics implements PooledRabbitMetrics {

  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;

  private final MetricCache cache;
  private final String connectionName;

  private volatile boolean closed = false;

  /**
   * Creates metrics for one manager.
   *
   * @param registry Micrometer registry (must not be null)
   * @param connectionName connection name this instance is closed for (must not be null)
   * @param maxCacheSize cached meter limit (must be &gt; 0)
   */
  public MicrometerPooledRabbitMetrics(
      @NonNull final MeterRegistry registry,
      @NonNull final String connectionName,
      final int maxCacheSize) {
    this.connectionName = connectionName;
    this.cache = new MetricCache(registry, maxCacheSize);

    log.debug(
        "Created MicrometerPooledRabbitMetrics for connection '{}' (maxCacheSize: {})",
        connectionName,
        maxCacheSize);
  }

  public MicrometerPooledRabbitMetrics(
      @NonNull final MeterRegistry registry, @NonNull final String connectionName) {
    this(registry, connectionName, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordResourceCreated(final String connectionName, final String poolName) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            RESOURCES_CREATED,
            "Resources created by the pool factory",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_POOL_NAME,
            poolName)
        .increment();
  }

  @Override
  public void recordCreationFailure(final String connectionName, final String poolName) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            CREATION_FAILURES,
            "Pool factory calls that failed (connect or channel open)",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_POOL_NAME,
            poolName)
        .increment();
  }

  @Override
  public void recordAcquireWait(
      final String connectionName, final String poolName, final long waitNanos) {
    if (closed) {
      return;
    }

    if (waitNanos < 0) {
      log.warn("Negative acquire wait: {}ns, skipping metric", waitNanos);
      return;
    }

    cache
        .getOrCreateTimer(
            ACQUIRE_WAIT,
            "Time from acquisition request to holding a resource, creation included",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_POOL_NAME,
            poolName)
        .record(waitNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void setPoolUsage(
      final String connectionName, final String poolName, final int live, final int idle) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateGaugeValue(
            POOL_LIVE,
            "Resources created and not discarded (idle, lent and adopted)",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_POOL_NAME,
            poolName)
        .set(live);
    cache
        .getOrCreateGaugeValue(
            POOL_IDLE,
            "Resources waiting in the pool",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_POOL_NAME,
            poolName)
        .set(idle);
  }

  @Override
  public void setQueueChannels(final String connectionName, final int count) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateGaugeValue(
            QUEUE_CHANNELS,
            "Channels pinned to queue names",
            TAG_CONNECTION_NAME,
            connectionName)
        .set(count);
  }

  @Override
  public void close(final String connectionName) {
    if (closed) {
      return;
    }

    if (!this.connectionName.equals(connectionName)) {
      log.warn(
          "Close called for connection '{}' but this instance is for '{}' - ignoring",
          connectionName,
          this.connectionName);
      return;
    }

    closed = true;

    try {
      final int removed = cache.removeConnection(connectionName);
      log.info(
          "Closed MicrometerPooledRabbitMetrics for connection '{}' ({} meters removed)",
          connectionName,
          removed);
    } catch (final RuntimeException e) {
      // Runs inside manager shutdown
      log.error("Error during metrics cleanup for connection '{}'", connectionName, e);
    }
  }

  public boolean isClosed() {
    return closed;
  }

  String getConnectionName() {
    return connectionName;
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }
}
