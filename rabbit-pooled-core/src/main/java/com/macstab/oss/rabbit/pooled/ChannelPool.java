/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled;

import static com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics.CHANNEL_POOL;

import java.util.OptionalInt;

import com.macstab.oss.rabbit.pooled.broker.BrokerChannel;
import com.macstab.oss.rabbit.pooled.broker.ChannelOptions;
import com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics;
import com.macstab.oss.rabbit.pooled.pool.BoundedPool;

import lombok.NonNull;

/**
 * Pool of channels minted over pooled connections.
 *
 * <p><strong>Factory:</strong>
 *
 * <pre>{@code
 * try (Lease<BrokerConnection> connection = connectionPool.acquire()) {  // (a) borrow a slot
 *   return connection.get().openChannel(options);                         // (b) open channel
 * }                                                                       // (c) slot returned
 * }</pre>
 *
 * <p>The connection slot is held only while the channel is being opened. The channel stays usable
 * after the borrow ends, so one connection slot mints many channels over time and channel
 * lifetime is decoupled from connection-pool occupancy.
 *
 * <p>Channels die before their connections: the manager closes this pool before the connection
 * pool.
 */
public final class ChannelPool extends BoundedPool<BrokerChannel> {

  public ChannelPool(
      @NonNull final ConnectionPool connectionPool,
      @NonNull final ChannelOptions options,
      @NonNull final OptionalInt maxSize,
      @NonNull final PooledRabbitMetrics metrics,
      @NonNull final String connectionName) {
    super(
        CHANNEL_POOL,
        () -> openChannel(connectionPool, options),
        maxSize,
        metrics,
        connectionName);
  }

  private static BrokerChannel openChannel(
      final ConnectionPool connectionPool, final ChannelOptions options) {
    try (var connection = connectionPool.acquire()) {
      return connection.get().openChannel(options);
    }
  }
}
