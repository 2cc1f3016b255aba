/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.exception;

/**
 * Root of all failures raised by the pooling layer and its broker adapters.
 *
 * <p>amqp-client's checked {@code IOException} / {@code TimeoutException} are translated exactly
 * once, at the adapter boundary. Pools and the manager never wrap, retry or suppress an exception
 * coming out of a resource factory.
 */
public class BrokerException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public BrokerException(final String message) {
    super(message);
  }

  public BrokerException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
