/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.exception;

/** Opening a channel on an otherwise healthy connection failed. */
public class ChannelCreationException extends BrokerException {

  private static final long serialVersionUID = 1L;

  public ChannelCreationException(final String message) {
    super(message);
  }

  public ChannelCreationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
