/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Meter names and tag keys.
 *
 * <p>All meters carry {@link #TAG_CONNECTION_NAME}; pool meters also carry {@link #TAG_POOL_NAME}
 * ({@code connections} or {@code channels}).
 *
 * <p><strong>Prometheus names:</strong> dots become underscores, counters get {@code _total},
 * timers {@code _seconds}, for example {@code rabbitmq_pooled_acquire_wait_seconds_count}.
 */
@UtilityClass
public class MetricsConfiguration {

  public static final String PREFIX = "rabbitmq.pooled";

  /** Counter: resources produced by a pool factory. */
  public static final String RESOURCES_CREATED = PREFIX + ".resources.created";

  /** Counter: pool factory calls that threw. */
  public static final String CREATION_FAILURES = PREFIX + ".resources.creation.failures";

  /** Timer: time from acquisition request to holding a resource. */
  public static final String ACQUIRE_WAIT = PREFIX + ".acquire.wait";

  /** Gauge: resources created and not discarded. */
  public static final String POOL_LIVE = PREFIX + ".pool.live";

  /** Gauge: resources waiting in the pool. */
  public static final String POOL_IDLE = PREFIX + ".pool.idle";

  /** Gauge: channels pinned to queue names. */
  public static final String QUEUE_CHANNELS = PREFIX + ".queue.channels";

  // Tag keys
  public static final String TAG_CONNECTION_NAME = "connection.name";
  public static final String TAG_POOL_NAME = "pool.name";
}
