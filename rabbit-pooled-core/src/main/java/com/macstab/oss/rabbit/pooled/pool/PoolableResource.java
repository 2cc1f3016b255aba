/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.pool;

/**
 * Lifecycle every pooled broker resource exposes.
 *
 * <p>{@link #close()} performs network I/O and may block. Pools call it only when {@link
 * #isOpen()} still reports {@code true}, so a resource closed twice through the pool sees a single
 * close.
 */
public interface PoolableResource {

  boolean isOpen();

  void close();
}
