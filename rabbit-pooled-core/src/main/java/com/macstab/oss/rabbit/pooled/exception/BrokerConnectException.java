/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.exception;

/** Opening a broker connection failed (network, authentication, protocol negotiation). */
public class BrokerConnectException extends BrokerException {

  private static final long serialVersionUID = 1L;

  public BrokerConnectException(final String message) {
    super(message);
  }

  public BrokerConnectException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
