/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.pool;

/**
 * Creates one new pooled resource.
 *
 * <p>Invoked at most once per reserved pool slot, never at pool construction, and always outside
 * the pool lock (creation opens sockets). Failures are thrown as unchecked exceptions and reach
 * the acquiring caller unmodified.
 *
 * @param <T> resource type
 */
@FunctionalInterface
public interface ResourceFactory<T extends PoolableResource> {

  T create();
}
