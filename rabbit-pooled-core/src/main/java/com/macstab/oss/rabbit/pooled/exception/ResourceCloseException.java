/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.exception;

/** Broker connection or channel could not be closed cleanly. */
public class ResourceCloseException extends BrokerException {

  private static final long serialVersionUID = 1L;

  public ResourceCloseException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
