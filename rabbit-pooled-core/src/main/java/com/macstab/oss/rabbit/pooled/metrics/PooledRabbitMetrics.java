/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.metrics;

/**
 * Metrics SPI for the pooling layer.
 *
 * <p><strong>Design:</strong>
 *
 * <ul>
 *   <li>All methods are default no-ops, so implementations override only what they export
 *   <li>{@link #NOOP} is used whenever no implementation is supplied (metrics module absent or
 *       disabled)
 *   <li>Every method takes the connection name as first dimension, so one registry can hold
 *       several managers (primary, events, audit)
 * </ul>
 *
 * <p><strong>Pool names:</strong> {@code "connections"} and {@code "channels"}; see {@link
 * #CONNECTION_POOL} and {@link #CHANNEL_POOL}.
 *
 * <p>Implementations MUST NOT throw. Calls sit on acquisition and teardown paths.
 */
public interface PooledRabbitMetrics {

  String CONNECTION_POOL = "connections";
  String CHANNEL_POOL = "channels";

  PooledRabbitMetrics NOOP = new PooledRabbitMetrics() {};

  /** A pool factory produced a new resource. */
  default void recordResourceCreated(String connectionName, String poolName) {
    // No-op by default
  }

  /** A pool factory threw. */
  default void recordCreationFailure(String connectionName, String poolName) {
    // No-op by default
  }

  /**
   * Time a caller spent between asking for a resource and holding it, creation included.
   *
   * @param waitNanos elapsed nanoseconds ({@code System.nanoTime()} delta)
   */
  default void recordAcquireWait(String connectionName, String poolName, long waitNanos) {
    // No-op by default
  }

  /**
   * Current pool occupancy.
   *
   * @param live resources created and not yet discarded (idle + lent + adopted)
   * @param idle resources waiting in the pool
   */
  default void setPoolUsage(String connectionName, String poolName, int live, int idle) {
    // No-op by default
  }

  /** Number of channels currently pinned to queues. */
  default void setQueueChannels(String connectionName, int count) {
    // No-op by default
  }

  /** Drops all meters of one connection. Idempotent. */
  default void close(String connectionName) {
    // No-op by default
  }
}
