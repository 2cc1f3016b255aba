/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.exception;

import lombok.Getter;

/**
 * Acquisition attempted on a pool (or manager) that has been closed.
 *
 * <p>Closed is terminal. Callers never receive a stale or {@code null} resource instead of this
 * exception.
 */
public class PoolClosedException extends BrokerException {

  private static final long serialVersionUID = 1L;

  @Getter private final String poolName;

  public PoolClosedException(final String poolName) {
    super("Pool '" + poolName + "' is closed");
    this.poolName = poolName;
  }
}
