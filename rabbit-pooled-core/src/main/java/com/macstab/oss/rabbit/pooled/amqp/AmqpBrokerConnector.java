/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.amqp;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import javax.net.ssl.SSLContext;

import com.macstab.oss.rabbit.pooled.BrokerUrls;
import com.macstab.oss.rabbit.pooled.broker.BrokerConnector;
import com.macstab.oss.rabbit.pooled.exception.BrokerConnectException;
import com.rabbitmq.client.ConnectionFactory;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link BrokerConnector} backed by RabbitMQ's amqp-client.
 *
 * <p><strong>Connection setup per call:</strong>
 *
 * <ol>
 *   <li>Fresh {@link ConnectionFactory} from the supplier (factories are mutable, never shared
 *       between connects)
 *   <li>{@code setUri(url)}: host, port, vhost, credentials; {@code amqps} switches TLS on
 *   <li>{@code setConnectionTimeout(timeout)} for the TCP connect
 *   <li>{@code useSslProtocol(sslContext)} when a context is given (overrides the scheme default)
 *   <li>Automatic + topology recovery: amqp-client reconnects the socket and re-opens channels
 *       underneath the pooled objects
 *   <li>{@code newConnection(connectionName)}: AMQP handshake, client-provided name visible in the
 *       management UI
 * </ol>
 *
 * <p>Checked amqp-client failures become {@link BrokerConnectException}; the password never appears
 * in the message.
 */
@Slf4j
public final class AmqpBrokerConnector implements BrokerConnector {

  private final Supplier<ConnectionFactory> connectionFactories;
  private final String connectionName;

  public AmqpBrokerConnector(@NonNull final String connectionName) {
    this(ConnectionFactory::new, connectionName);
  }

  /**
   * Creates connector with a custom factory supplier (pre-configured heartbeat, executor, metrics
   * collector, or a test double).
   *
   * @param connectionFactories supplies a new factory per connect
   * @param connectionName client-provided connection name
   */
  public AmqpBrokerConnector(
      @NonNull final Supplier<ConnectionFactory> connectionFactories,
      @NonNull final String connectionName) {
    this.connectionFactories = connectionFactories;
    this.connectionName = connectionName;
  }

  @Override
  public AmqpBrokerConnection connect(
      @NonNull final String url, @NonNull final Duration timeout, final SSLContext sslContext) {
    final var redactedUrl = BrokerUrls.redact(url);
    final var factory = connectionFactories.get();

    try {
      factory.setUri(url);
    } catch (final URISyntaxException | GeneralSecurityException | IllegalArgumentException ex) {
      throw new BrokerConnectException("Invalid broker URL: " + redactedUrl, ex);
    }

    factory.setConnectionTimeout(toTimeoutMillis(timeout));
    if (sslContext != null) {
      factory.useSslProtocol(sslContext);
    }
    factory.setAutomaticRecoveryEnabled(true);
    factory.setTopologyRecoveryEnabled(true);

    try {
      final var connection = factory.newConnection(connectionName);

      if (log.isDebugEnabled()) {
        log.debug(
            "Opened broker connection to {} (name: {}, tls: {})",
            redactedUrl,
            connectionName,
            sslContext != null || factory.isSSL());
      }

      return new AmqpBrokerConnection(connection);
    } catch (final IOException | TimeoutException ex) {
      throw new BrokerConnectException("Failed to connect to broker at " + redactedUrl, ex);
    }
  }

  private static int toTimeoutMillis(final Duration timeout) {
    final long millis = timeout.toMillis();
    return millis > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) millis;
  }
}
