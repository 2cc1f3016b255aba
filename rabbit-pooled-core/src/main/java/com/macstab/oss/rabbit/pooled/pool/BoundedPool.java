/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.pool;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.macstab.oss.rabbit.pooled.exception.PoolAcquireInterruptedException;
import com.macstab.oss.rabbit.pooled.exception.PoolClosedException;
import com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Capacity-bounded, lazily filled pool of broker resources.
 *
 * <p><strong>State:</strong>
 *
 * <ul>
 *   <li>{@code live}: every resource this pool created and has not discarded. Idle, lent and
 *       adopted (unscoped) resources all count. {@code live.size() + pendingCreations <= maxSize}
 *   <li>{@code idle}: resources ready to be lent, LIFO (the most recently used stays warm)
 *   <li>{@code pendingCreations}: slots reserved for factory calls currently in flight
 * </ul>
 *
 * <p><strong>Acquisition:</strong> take an idle resource if any; otherwise reserve a slot if
 * capacity allows and run the factory outside the lock; otherwise park on {@code released}.
 * Every release (and every failed creation) signals one waiter. Wait order is the {@link
 * ReentrantLock} queue order; no fairness is promised beyond eventual wake-up.
 *
 * <p><strong>Closed is terminal:</strong> no resource is handed out or created after {@link
 * #close()}. A creation that finishes after close closes its own resource and throws {@link
 * PoolClosedException}, so a resource created concurrently with close never leaks.
 *
 * <p><strong>Unscoped get:</strong> {@link #getUnscoped()} transfers ownership. The resource keeps
 * its capacity slot and is still closed by {@link #close()} if its new owner has not closed it.
 *
 * @param <T> resource type
 */
@Slf4j
public class BoundedPool<T extends PoolableResource> implements AutoCloseable {

  @Getter private final String name;
  private final ResourceFactory<T> factory;
  private final int maxSize; // <= 0: unbounded
  private final PooledRabbitMetrics metrics;
  private final String connectionName;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition released = lock.newCondition();
  private final Set<T> live = new LinkedHashSet<>();
  private final Deque<T> idle = new ArrayDeque<>();
  private int pendingCreations;
  private volatile boolean closed;

  /**
   * Creates an empty pool. No resource is created here.
   *
   * @param name pool name (logs, metrics, {@link PoolClosedException})
   * @param factory resource factory
   * @param maxSize capacity, empty for unbounded
   */
  public BoundedPool(
      @NonNull final String name,
      @NonNull final ResourceFactory<T> factory,
      @NonNull final OptionalInt maxSize) {
    this(name, factory, maxSize, PooledRabbitMetrics.NOOP, "default");
  }

  /**
   * Creates an empty pool reporting to {@code metrics}.
   *
   * @param name pool name (logs, metrics, {@link PoolClosedException})
   * @param factory resource factory
   * @param maxSize capacity, empty for unbounded; must be &gt;= 1 when present
   * @param metrics metrics collector
   * @param connectionName metrics dimension
   */
  public BoundedPool(
      @NonNull final String name,
      @NonNull final ResourceFactory<T> factory,
      @NonNull final OptionalInt maxSize,
      @NonNull final PooledRabbitMetrics metrics,
      @NonNull final String connectionName) {
    if (maxSize.isPresent() && maxSize.getAsInt() < 1) {
      throw new IllegalArgumentException(
          "Pool '" + name + "' maxSize must be >= 1, got: " + maxSize.getAsInt());
    }
    this.name = name;
    this.factory = factory;
    this.maxSize = maxSize.orElse(0);
    this.metrics = metrics;
    this.connectionName = connectionName;
  }

  /**
   * Borrows a resource for the scope of the returned lease.
   *
   * <p>Blocks while the pool is at capacity with nothing idle. Closing the lease returns the
   * resource (once).
   *
   * @throws PoolClosedException pool closed before or while waiting
   * @throws PoolAcquireInterruptedException interrupted while waiting
   */
  public Lease<T> acquire() {
    return Lease.pooled(obtain(), this::release);
  }

  /**
   * Takes a resource with no obligation to return it.
   *
   * <p><strong>Ownership transfer:</strong> the caller owns the result and must never hand it
   * back through a lease. It stays counted against capacity.
   *
   * @throws PoolClosedException pool closed before or while waiting
   * @throws PoolAcquireInterruptedException interrupted while waiting
   */
  public T getUnscoped() {
    return obtain();
  }

  /**
   * Closes every live resource still open and marks the pool closed. Idempotent.
   *
   * <p>Close failures of single resources are logged; the remaining resources are still closed.
   * Parked waiters wake up with {@link PoolClosedException}.
   */
  @Override
  public void close() {
    final List<T> toClose;

    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      toClose = new ArrayList<>(live);
      live.clear();
      idle.clear();
      released.signalAll();
    } finally {
      lock.unlock();
    }

    int closedCount = 0;
    for (final var resource : toClose) {
      if (closeIfOpen(resource)) {
        closedCount++;
      }
    }
    metrics.setPoolUsage(connectionName, name, 0, 0);

    if (log.isDebugEnabled()) {
      log.debug(
          "Closed pool '{}' ({} of {} resources still open were closed)",
          name,
          closedCount,
          toClose.size());
    }
  }

  public boolean isClosed() {
    return closed;
  }

  public OptionalInt getMaxSize() {
    return maxSize > 0 ? OptionalInt.of(maxSize) : OptionalInt.empty();
  }

  /** Resources created and not discarded: idle, lent and adopted. */
  public int getLiveCount() {
    lock.lock();
    try {
      return live.size();
    } finally {
      lock.unlock();
    }
  }

  /** Resources ready to be lent without creation or waiting. */
  public int getIdleCount() {
    lock.lock();
    try {
      return idle.size();
    } finally {
      lock.unlock();
    }
  }

  // ==================== Private Methods ====================

  private T obtain() {
    final long start = System.nanoTime();

    lock.lock();
    try {
      while (true) {
        checkNotClosed();

        final T reusable = pollOpenIdle();
        if (reusable != null) {
          publishUsage();
          metrics.recordAcquireWait(connectionName, name, System.nanoTime() - start);
          return reusable;
        }

        if (hasCapacity()) {
          pendingCreations++;
          break;
        }

        awaitRelease();
      }
    } finally {
      lock.unlock();
    }

    final T created = create();
    metrics.recordAcquireWait(connectionName, name, System.nanoTime() - start);
    return created;
  }

  /** Runs the factory for an already reserved slot. Caller must NOT hold the lock. */
  private T create() {
    final T resource;
    try {
      resource = factory.create();
    } catch (final RuntimeException | Error ex) {
      lock.lock();
      try {
        pendingCreations--;
        released.signal();
      } finally {
        lock.unlock();
      }
      metrics.recordCreationFailure(connectionName, name);
      throw ex;
    }

    final boolean closedMeanwhile;
    lock.lock();
    try {
      pendingCreations--;
      closedMeanwhile = closed;
      if (!closedMeanwhile) {
        live.add(resource);
        publishUsage();
      }
    } finally {
      lock.unlock();
    }

    if (closedMeanwhile) {
      closeIfOpen(resource);
      throw new PoolClosedException(name);
    }

    metrics.recordResourceCreated(connectionName, name);
    if (log.isDebugEnabled()) {
      log.debug("Pool '{}' created resource {} (live: {})", name, resource, getLiveCount());
    }
    return resource;
  }

  private void release(final T resource) {
    boolean discard = false;

    lock.lock();
    try {
      if (closed || !live.contains(resource)) {
        return;
      }
      if (resource.isOpen()) {
        idle.addFirst(resource);
      } else {
        live.remove(resource);
        discard = true;
      }
      publishUsage();
      released.signal();
    } finally {
      lock.unlock();
    }

    if (discard && log.isDebugEnabled()) {
      log.debug("Pool '{}' discarded closed resource {} on release", name, resource);
    }
  }

  /** Caller holds the lock. Skips (and forgets) idle resources closed behind the pool's back. */
  private T pollOpenIdle() {
    T candidate;
    while ((candidate = idle.pollFirst()) != null) {
      if (candidate.isOpen()) {
        return candidate;
      }
      live.remove(candidate);
      if (log.isDebugEnabled()) {
        log.debug("Pool '{}' discarded closed idle resource {}", name, candidate);
      }
    }
    return null;
  }

  /** Caller holds the lock. */
  private boolean hasCapacity() {
    return maxSize <= 0 || live.size() + pendingCreations < maxSize;
  }

  /** Caller holds the lock. */
  private void awaitRelease() {
    try {
      released.await();
    } catch (final InterruptedException ex) {
      Thread.currentThread().interrupt();
      // Pass the wake-up on: the signal this thread may have consumed belongs to another waiter
      released.signal();
      throw new PoolAcquireInterruptedException(name, ex);
    }
  }

  /** Caller holds the lock. */
  private void publishUsage() {
    metrics.setPoolUsage(connectionName, name, live.size(), idle.size());
  }

  private void checkNotClosed() {
    if (closed) {
      throw new PoolClosedException(name);
    }
  }

  private boolean closeIfOpen(final T resource) {
    if (!resource.isOpen()) {
      return false;
    }
    try {
      resource.close();
      return true;
    } catch (final RuntimeException ex) {
      log.warn("Pool '{}' failed to close resource {}", name, resource, ex);
      return false;
    }
  }

  @Override
  public String toString() {
    return String.format(
        "BoundedPool[%s, maxSize=%s, closed=%s]",
        name, maxSize > 0 ? String.valueOf(maxSize) : "unbounded", closed);
  }
}
