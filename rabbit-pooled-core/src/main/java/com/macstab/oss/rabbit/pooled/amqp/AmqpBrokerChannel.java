/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.amqp;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeoutException;

import com.macstab.oss.rabbit.pooled.broker.BrokerChannel;
import com.macstab.oss.rabbit.pooled.broker.ChannelOptions;
import com.macstab.oss.rabbit.pooled.exception.MessageReturnedException;
import com.macstab.oss.rabbit.pooled.exception.ResourceCloseException;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Return;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link BrokerChannel} over an amqp-client {@link Channel}.
 *
 * <p><strong>On-return-raises:</strong> amqp-client reports unroutable mandatory messages
 * asynchronously through a {@code ReturnListener}. With {@link ChannelOptions#isOnReturnRaises()}
 * the listener queues every {@link Return}; the publishing layer calls {@link #throwIfReturned()}
 * after a mandatory publish (and confirm wait) to turn a return into {@link
 * MessageReturnedException}. Without the flag returns are only logged.
 */
@Slf4j
public final class AmqpBrokerChannel implements BrokerChannel {

  /** Native channel (publish, consume, declare). */
  @Getter private final Channel delegate;

  @Getter private final boolean publisherConfirms;
  @Getter private final boolean onReturnRaises;

  private final Queue<Return> returns = new ConcurrentLinkedQueue<>();

  AmqpBrokerChannel(@NonNull final Channel delegate, @NonNull final ChannelOptions options) {
    this.delegate = delegate;
    this.publisherConfirms = options.isPublisherConfirms();
    this.onReturnRaises = options.isOnReturnRaises();
    delegate.addReturnListener(this::onReturn);
  }

  /**
   * Raises for the oldest return not yet reported.
   *
   * @throws MessageReturnedException a mandatory message came back unroutable
   */
  public void throwIfReturned() {
    final var returned = returns.poll();
    if (returned != null) {
      throw new MessageReturnedException(
          returned.getReplyCode(),
          returned.getReplyText(),
          returned.getExchange(),
          returned.getRoutingKey());
    }
  }

  /** Returns queued and not yet raised. */
  public int getPendingReturnCount() {
    return returns.size();
  }

  @Override
  public int getChannelNumber() {
    return delegate.getChannelNumber();
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
        log.debug("Channel {} was already closed", getChannelNumber());
      }
    } catch (final IOException | TimeoutException ex) {
      throw new ResourceCloseException("Failed to close channel " + getChannelNumber(), ex);
    }
  }

  private void onReturn(final Return returned) {
    if (onReturnRaises) {
      returns.add(returned);
      return;
    }
    if (log.isWarnEnabled()) {
      log.warn(
          "Message returned on channel {}: {} {} (exchange='{}', routingKey='{}')",
          getChannelNumber(),
          returned.getReplyCode(),
          returned.getReplyText(),
          returned.getExchange(),
          returned.getRoutingKey());
    }
  }

  @Override
  public String toString() {
    return String.format("AmqpChannel[%d, open=%s]", getChannelNumber(), isOpen());
  }
}
