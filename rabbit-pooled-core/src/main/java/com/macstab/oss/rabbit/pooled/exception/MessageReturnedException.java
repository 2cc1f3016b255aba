/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.exception;

import lombok.Getter;

/**
 * A mandatory message was returned by the broker as unroutable on a channel opened with
 * on-return-raises.
 */
@Getter
public class MessageReturnedException extends BrokerException {

  private static final long serialVersionUID = 1L;

  private final int replyCode;
  private final String replyText;
  private final String exchange;
  private final String routingKey;

  public MessageReturnedException(
      final int replyCode, final String replyText, final String exchange, final String routingKey) {
    super(
        String.format(
            "Message returned by broker: %d %s (exchange='%s', routingKey='%s')",
            replyCode, replyText, exchange, routingKey));
    this.replyCode = replyCode;
    this.replyText = replyText;
    this.exchange = exchange;
    this.routingKey = routingKey;
  }
}
