/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.exception;

/**
 * Thread was interrupted while parked waiting for pool capacity.
 *
 * <p>The interrupt flag is restored before this is thrown.
 */
public class PoolAcquireInterruptedException extends BrokerException {

  private static final long serialVersionUID = 1L;

  public PoolAcquireInterruptedException(final String poolName, final InterruptedException cause) {
    super("Interrupted while waiting for a resource from pool '" + poolName + "'", cause);
  }
}
