/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.amqp;

import java.io.IOException;

import com.macstab.oss.rabbit.pooled.broker.BrokerConnection;
import com.macstab.oss.rabbit.pooled.broker.ChannelOptions;
import com.macstab.oss.rabbit.pooled.exception.ChannelCreationException;
import com.macstab.oss.rabbit.pooled.exception.ResourceCloseException;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/** {@link BrokerConnection} over an amqp-client {@link Connection}. */
@Slf4j
public final class AmqpBrokerConnection implements BrokerConnection {

  /** Native connection, for callers that need amqp-client API beyond channel creation. */
  @Getter private final Connection delegate;

  public AmqpBrokerConnection(@NonNull final Connection delegate) {
    this.delegate = delegate;
  }

  /**
   * Opens a channel.
   *
   * <p>{@code createChannel()} returns {@code null} when the requested number is taken or the
   * negotiated channel-max is reached; both surface as {@link ChannelCreationException}. With
   * publisher confirms, {@code confirmSelect()} runs before the channel is handed out; if it fails
   * the half-configured channel is closed first.
   */
  @Override
  public AmqpBrokerChannel openChannel(@NonNull final ChannelOptions options) {
    final Channel channel;
    try {
      channel =
          options.getChannelNumber() == null
              ? delegate.createChannel()
              : delegate.createChannel(options.getChannelNumber());
    } catch (final IOException | AlreadyClosedException ex) {
      throw new ChannelCreationException("Failed to open channel on " + this, ex);
    }

    if (channel == null) {
      throw new ChannelCreationException(
          options.getChannelNumber() == null
              ? "No channel available on " + this + " (channel-max reached)"
              : "Channel " + options.getChannelNumber() + " unavailable on " + this);
    }

    if (options.isPublisherConfirms()) {
      try {
        channel.confirmSelect();
      } catch (final IOException | AlreadyClosedException ex) {
        final var failure =
            new ChannelCreationException(
                "Failed to enable publisher confirms on channel " + channel.getChannelNumber(),
                ex);
        abort(channel, failure);
        throw failure;
      }
    }

    return new AmqpBrokerChannel(channel, options);
  }

  @Override
  public boolean isOpen() {
    return delegate.isOpen();
  }

  @Override
  public void close() {
    try {
      delegate.close();
    } catch (final AlreadyClosedException ex) {
      if (log.isDebugEnabled()) {
        log.debug("Connection {} was already closed", this);
      }
    } catch (final IOException ex) {
      throw new ResourceCloseException("Failed to close " + this, ex);
    }
  }

  private static void abort(final Channel channel, final Exception failure) {
    try {
      channel.abort();
    } catch (final IOException ex) {
      failure.addSuppressed(ex);
    }
  }

  @Override
  public String toString() {
    return String.format(
        "AmqpConnection[%s, open=%s]",
        delegate.getClientProvidedName() != null ? delegate.getClientProvidedName() : "unnamed",
        delegate.isOpen());
  }
}
