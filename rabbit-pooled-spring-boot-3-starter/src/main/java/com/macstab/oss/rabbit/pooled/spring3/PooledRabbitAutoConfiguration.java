/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.spring3;

import java.security.NoSuchAlgorithmException;
import java.util.Optional;

import javax.net.ssl.SSLContext;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import com.macstab.oss.rabbit.pooled.BrokerUrls;
import com.macstab.oss.rabbit.pooled.ConnectionManagerSettings;
import com.macstab.oss.rabbit.pooled.PooledConnectionManager;
import com.macstab.oss.rabbit.pooled.amqp.AmqpBrokerConnector;
import com.macstab.oss.rabbit.pooled.broker.BrokerConnector;
import com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics;

import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration of a {@link PooledConnectionManager}.
 *
 * <p><strong>Activation:</strong> {@code spring.rabbitmq.pooled.enabled=true}. Runs after the
 * metrics auto-configuration so a {@link PooledRabbitMetrics} bean (Micrometer or NOOP) is picked
 * up when the metrics module is present.
 *
 * <p><strong>Beans:</strong>
 *
 * <ul>
 *   <li>{@link BrokerConnector}: amqp-client connector, replaceable by a user bean
 *   <li>{@link PooledConnectionManager}: closed on context shutdown; nothing connects before the
 *       first acquisition
 * </ul>
 *
 * <p><strong>TLS:</strong> {@code spring.rabbitmq.pooled.ssl.bundle} resolves through {@link
 * SslBundles}; {@code ssl.enabled} without a bundle uses {@link SSLContext#getDefault()}; an
 * {@code amqps://} URL without {@code ssl.enabled} gets amqp-client's scheme default.
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "com.macstab.oss.rabbit.pooled.metrics.autoconfigure.PooledRabbitMetricsAutoConfiguration")
@ConditionalOnClass(PooledConnectionManager.class)
@ConditionalOnProperty(prefix = "spring.rabbitmq.pooled", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(PooledRabbitProperties.class)
public class PooledRabbitAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(BrokerConnector.class)
  public BrokerConnector pooledRabbitBrokerConnector(final PooledRabbitProperties properties) {
    return new AmqpBrokerConnector(properties.getConnectionName());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(PooledConnectionManager.class)
  public PooledConnectionManager pooledConnectionManager(
      final PooledRabbitProperties properties,
      final BrokerConnector connector,
      final ObjectProvider<SslBundles> sslBundles,
      final ObjectProvider<PooledRabbitMetrics> metricsProvider) {

    final var settings = buildSettings(properties, sslBundles);
    final var metrics = Optional.ofNullable(metricsProvider.getIfAvailable());

    if (log.isInfoEnabled()) {
      log.info(
          "Pooled RabbitMQ: url={}, connections={}, channels={}, metrics={}",
          BrokerUrls.redact(settings.getUrl()),
          settings.getConnectionPoolSize() != null ? settings.getConnectionPoolSize() : "unbounded",
          settings.getChannelPoolSize() != null ? settings.getChannelPoolSize() : "unbounded",
          metrics.filter(m -> m != PooledRabbitMetrics.NOOP).isPresent() ? "enabled" : "disabled");
    }

    return new PooledConnectionManager(connector, settings, metrics);
  }

  // ==================== Private Methods ====================

  private ConnectionManagerSettings buildSettings(
      final PooledRabbitProperties properties, final ObjectProvider<SslBundles> sslBundles) {
    return ConnectionManagerSettings.builder()
        .url(properties.getUrl())
        .connectTimeout(properties.getConnectTimeout())
        .sslContext(resolveSslContext(properties.getSsl(), sslBundles))
        .connectionPoolSize(properties.getConnectionPoolSize())
        .channelPoolSize(properties.getChannelPoolSize())
        .channelNumber(properties.getChannelNumber())
        .publisherConfirms(properties.isPublisherConfirms())
        .onReturnRaises(properties.isOnReturnRaises())
        .connectionName(properties.getConnectionName())
        .build();
  }

  private SSLContext resolveSslContext(
      final PooledRabbitProperties.Ssl ssl, final ObjectProvider<SslBundles> sslBundles) {
    if (ssl == null || !ssl.isEnabled()) {
      return null;
    }

    final var bundleName = ssl.getBundle();
    if (StringUtils.hasText(bundleName)) {
      final var bundles = sslBundles.getIfAvailable();
      if (bundles == null) {
        throw new IllegalStateException(
            "SSL bundle '" + bundleName + "' configured but no SslBundles bean is available");
      }
      if (log.isDebugEnabled()) {
        log.debug("SSL enabled with bundle: {}", bundleName);
      }
      return bundles.getBundle(bundleName).createSslContext();
    }

    if (log.isDebugEnabled()) {
      log.debug("SSL enabled (JVM default context, no bundle)");
    }
    try {
      return SSLContext.getDefault();
    } catch (final NoSuchAlgorithmException ex) {
      throw new IllegalStateException("No default SSLContext available", ex);
    }
  }
}
