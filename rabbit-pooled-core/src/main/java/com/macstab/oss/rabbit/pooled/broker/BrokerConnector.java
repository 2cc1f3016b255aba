/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.broker;

import java.time.Duration;

import javax.net.ssl.SSLContext;

import com.macstab.oss.rabbit.pooled.exception.BrokerConnectException;

/**
 * Opens broker connections. The connection pool's factory calls this once per new pool slot.
 *
 * <p>Implementations may reconnect transparently underneath the returned connection (amqp-client
 * automatic recovery); the pooling layer itself never retries.
 */
@FunctionalInterface
public interface BrokerConnector {

  /**
   * Opens a new connection. Blocks for at most {@code timeout} on the network handshake.
   *
   * @param url broker URL ({@code amqp://} or {@code amqps://}), may carry credentials
   * @param timeout connect timeout
   * @param sslContext TLS context, {@code null} for plain TCP or the scheme's default
   * @return open connection
   * @throws BrokerConnectException the connection could not be established
   */
  BrokerConnection connect(String url, Duration timeout, SSLContext sslContext);
}
