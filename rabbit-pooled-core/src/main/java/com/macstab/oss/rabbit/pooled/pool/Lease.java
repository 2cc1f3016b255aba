/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.pool;

import static lombok.AccessLevel.PRIVATE;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Scoped hold on a resource. Use with try-with-resources:
 *
 * <pre>{@code
 * try (Lease<BrokerChannel> lease = manager.acquireChannel()) {
 *   publish(lease.get());
 * }
 * }</pre>
 *
 * <p>Pooled lease: {@link #close()} returns the resource to its pool exactly once, whatever the
 * number of calls. Pinned lease (per-queue channel): {@link #close()} does nothing, the resource
 * stays with its owner until the manager closes.
 *
 * @param <T> resource type
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class Lease<T> implements AutoCloseable {

  T resource;
  Consumer<? super T> releaser;
  AtomicBoolean released;

  private Lease(final T resource, final Consumer<? super T> releaser) {
    this.resource = resource;
    this.releaser = releaser;
    this.released = new AtomicBoolean(false);
  }

  /** Lease that hands the resource back through {@code releaser} on close. */
  public static <T> Lease<T> pooled(
      @NonNull final T resource, @NonNull final Consumer<? super T> releaser) {
    return new Lease<>(resource, releaser);
  }

  /** Lease over a resource owned elsewhere; closing it releases nothing. */
  public static <T> Lease<T> pinned(@NonNull final T resource) {
    return new Lease<>(resource, null);
  }

  public T get() {
    return resource;
  }

  public boolean isPinned() {
    return releaser == null;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true) && releaser != null) {
      releaser.accept(resource);
    }
  }

  @Override
  public String toString() {
    return String.format("Lease[%s, pinned=%s, released=%s]", resource, isPinned(), isReleased());
  }
}
