/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled;

import java.util.Optional;
import java.util.function.BooleanSupplier;

import com.macstab.oss.rabbit.pooled.amqp.AmqpBrokerConnector;
import com.macstab.oss.rabbit.pooled.broker.BrokerChannel;
import com.macstab.oss.rabbit.pooled.broker.BrokerConnection;
import com.macstab.oss.rabbit.pooled.broker.BrokerConnector;
import com.macstab.oss.rabbit.pooled.exception.PoolClosedException;
import com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics;
import com.macstab.oss.rabbit.pooled.pool.Lease;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded connection and channel pooling with per-queue channel affinity.
 *
 * <p><strong>Layers:</strong>
 *
 * <pre>
 * PooledConnectionManager
 *   ├─→ QueueChannelAffinity  queue name → pinned channel (outside pool rotation)
 *   │     └─→ ChannelPool.getUnscoped()
 *   ├─→ ChannelPool            channels, lent per scope
 *   │     └─→ factory: ConnectionPool.acquire() → openChannel() → release connection slot
 *   └─→ ConnectionPool         connections, lent per scope
 *         └─→ factory: BrokerConnector.connect(url, timeout, sslContext)
 * </pre>
 *
 * <p>Nothing connects at construction; every resource is created on first demand beyond what is
 * idle.
 *
 * <p><strong>Shutdown ({@link #close()}):</strong> strict order, each step skipped when its target
 * is already closed:
 *
 * <ol>
 *   <li>Close every channel pinned to a queue
 *   <li>Close the channel pool (remaining shared channels)
 *   <li>Close the connection pool
 * </ol>
 *
 * <p>Channels go before the connections that carry them. Pinned channels go before the pools,
 * which do not lend them any more. Closed is terminal; every acquisition afterwards throws {@link
 * PoolClosedException}.
 *
 * <p><strong>Usage:</strong>
 *
 * <pre>{@code
 * try (Lease<BrokerChannel> lease = manager.acquireChannel()) {          // shared, returned
 *   publish(lease.get());
 * }
 * try (Lease<BrokerChannel> lease = manager.acquireChannel("orders")) {  // pinned, stays
 *   consume(lease.get());
 * }
 * }</pre>
 */
@Slf4j
public final class PooledConnectionManager implements AutoCloseable {

  @Getter private final ConnectionPool connectionPool;
  @Getter private final ChannelPool channelPool;
  private final QueueChannelAffinity queueChannels;
  private final PooledRabbitMetrics metrics;
  @Getter private final String connectionName;
  private volatile boolean closed;

  /**
   * Creates manager connecting through RabbitMQ's amqp-client (no metrics).
   *
   * @param settings connection and pool settings (must not be null)
   */
  public PooledConnectionManager(@NonNull final ConnectionManagerSettings settings) {
    this(new AmqpBrokerConnector(settings.getConnectionName()), settings, Optional.empty());
  }

  /**
   * Creates manager with a custom connector (no metrics).
   *
   * @param connector opens broker connections (must not be null)
   * @param settings connection and pool settings (must not be null)
   */
  public PooledConnectionManager(
      @NonNull final BrokerConnector connector, @NonNull final ConnectionManagerSettings settings) {
    this(connector, settings, Optional.empty());
  }

  /**
   * Creates manager with a custom connector and metrics.
   *
   * <p>If metrics are not provided, {@link PooledRabbitMetrics#NOOP} is used.
   *
   * @param connector opens broker connections (must not be null)
   * @param settings connection and pool settings (must not be null)
   * @param metrics metrics collector (optional)
   * @throws IllegalArgumentException invalid settings
   */
  public PooledConnectionManager(
      @NonNull final BrokerConnector connector,
      @NonNull final ConnectionManagerSettings settings,
      @NonNull final Optional<PooledRabbitMetrics> metrics) {
    settings.validate();

    this.metrics = metrics.orElse(PooledRabbitMetrics.NOOP);
    this.connectionName = settings.getConnectionName();
    this.connectionPool = new ConnectionPool(connector, settings, this.metrics);
    this.channelPool =
        new ChannelPool(
            connectionPool,
            settings.channelOptions(),
            settings.channelPoolCapacity(),
            this.metrics,
            connectionName);
    this.queueChannels = new QueueChannelAffinity(channelPool, this.metrics, connectionName);

    if (log.isInfoEnabled()) {
      log.info("Created PooledConnectionManager: {}", settings);
    }
  }

  /**
   * Takes a connection with no obligation to return it (ownership transfer).
   *
   * <p>The connection keeps its pool slot and is closed with the pool if still open.
   */
  public BrokerConnection getConnection() {
    checkNotClosed();
    return connectionPool.getUnscoped();
  }

  /** Borrows a connection; closing the lease returns it to the pool. */
  public Lease<BrokerConnection> acquireConnection() {
    checkNotClosed();
    return connectionPool.acquire();
  }

  /**
   * Takes a channel with no obligation to return it (ownership transfer).
   *
   * <p>The channel keeps its pool slot and is closed with the pool if still open.
   */
  public BrokerChannel getChannel() {
    checkNotClosed();
    return channelPool.getUnscoped();
  }

  /** Borrows a shared channel; closing the lease returns it to the pool. */
  public Lease<BrokerChannel> acquireChannel() {
    return acquireChannel(null);
  }

  /**
   * Borrows a shared channel, or the channel pinned to {@code queueName}.
   *
   * <ul>
   *   <li>{@code null}: same as {@link #acquireChannel()}
   *   <li>first call for a queue name: a channel is taken from the pool and pinned to the name
   *   <li>later calls: the pinned channel, no acquisition
   * </ul>
   *
   * <p>A pinned lease ({@link Lease#isPinned()}) releases nothing when closed.
   *
   * @param queueName queue to pin a channel to, or {@code null}
   */
  public Lease<BrokerChannel> acquireChannel(final String queueName) {
    checkNotClosed();
    if (queueName == null) {
      return channelPool.acquire();
    }
    return Lease.pinned(queueChannels.channelFor(queueName));
  }

  public int getQueueChannelCount() {
    return queueChannels.size();
  }

  public boolean hasQueueChannel(final String queueName) {
    return queueChannels.contains(queueName);
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes pinned channels, then the channel pool, then the connection pool. Idempotent.
   *
   * <p>A failing step is logged and does not prevent the following steps.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }

    closed = true;

    runStep("queue channels", queueChannels::isClosed, queueChannels::closeAll);
    runStep("channel pool", channelPool::isClosed, channelPool::close);
    runStep("connection pool", connectionPool::isClosed, connectionPool::close);

    metrics.close(connectionName);

    if (log.isInfoEnabled()) {
      log.info("Closed PooledConnectionManager (connection: {})", connectionName);
    }
  }

  // ==================== Private Methods ====================

  private void checkNotClosed() {
    if (closed) {
      throw new PoolClosedException("manager:" + connectionName);
    }
  }

  private void runStep(final String step, final BooleanSupplier done, final Runnable action) {
    if (done.getAsBoolean()) {
      return;
    }
    try {
      action.run();
    } catch (final RuntimeException ex) {
      log.error("Error closing {} (connection: {})", step, connectionName, ex);
    }
  }
}
