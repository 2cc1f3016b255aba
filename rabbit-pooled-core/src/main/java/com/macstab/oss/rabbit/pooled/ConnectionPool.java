/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled;

import static com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics.CONNECTION_POOL;

import com.macstab.oss.rabbit.pooled.broker.BrokerConnection;
import com.macstab.oss.rabbit.pooled.broker.BrokerConnector;
import com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics;
import com.macstab.oss.rabbit.pooled.pool.BoundedPool;

import lombok.NonNull;

/**
 * Pool of broker connections.
 *
 * <p>The factory calls {@link BrokerConnector#connect} with the configured URL, timeout and TLS
 * context; nothing else is added on top of {@link BoundedPool}.
 */
public final class ConnectionPool extends BoundedPool<BrokerConnection> {

  public ConnectionPool(
      @NonNull final BrokerConnector connector,
      @NonNull final ConnectionManagerSettings settings,
      @NonNull final PooledRabbitMetrics metrics) {
    super(
        CONNECTION_POOL,
        () ->
            connector.connect(
                settings.getUrl(), settings.getConnectTimeout(), settings.getSslContext()),
        settings.connectionPoolCapacity(),
        metrics,
        settings.getConnectionName());
  }
}
