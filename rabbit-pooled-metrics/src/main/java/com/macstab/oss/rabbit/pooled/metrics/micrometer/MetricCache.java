/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.metrics.micrometer;

import static com.macstab.oss.rabbit.pooled.metrics.micrometer.MetricsConfiguration.TAG_CONNECTION_NAME;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache of Micrometer meters keyed by name and tags.
 *
 * <p><strong>Problem:</strong> registry lookup with tag matching costs far more than an increment,
 * and pool metrics are recorded on every acquisition.
 *
 * <p><strong>Solution:</strong> {@link Counter}, {@link Timer} and gauge backing values ({@link
 * AtomicInteger}) live in {@code ConcurrentHashMap}s. The first access registers the meter, later
 * accesses are a map lookup.
 *
 * <p><strong>Bounded:</strong> at most {@code maxCacheSize} meters are cached. Beyond that the
 * registry is used directly; Micrometer deduplicates counters and timers by id, a gauge registered
 * past the limit keeps its first backing value.
 *
 * <p><strong>Key format:</strong> {@code metric.name:tag1=value1:tag2=value2}, tags in call order.
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters;
  private final ConcurrentHashMap<String, Timer> timers;
  private final ConcurrentHashMap<String, AtomicInteger> gaugeValues;
  private final ConcurrentHashMap<String, Meter.Id> ids;
  private final AtomicInteger cacheSize;

  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.registry = registry;
    this.maxCacheSize = maxCacheSize;
    this.counters = new ConcurrentHashMap<>(32);
    this.timers = new ConcurrentHashMap<>(16);
    this.gaugeValues = new ConcurrentHashMap<>(32);
    this.ids = new ConcurrentHashMap<>(64);
    this.cacheSize = new AtomicInteger(0);
  }

  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {
    return getOrCreate(
        counters,
        name,
        tagPairs,
        () -> Counter.builder(name).description(description).tags(tagPairs).register(registry),
        Counter::getId);
  }

  Timer getOrCreateTimer(final String name, final String description, final String... tagPairs) {
    return getOrCreate(
        timers,
        name,
        tagPairs,
        () -> Timer.builder(name).description(description).tags(tagPairs).register(registry),
        Timer::getId);
  }

  /** Returns the value backing a gauge; setting it changes what the gauge reports. */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {
    final var value = new AtomicInteger(0);
    final var holder = new Meter.Id[1];
    return getOrCreate(
        gaugeValues,
        name,
        tagPairs,
        () -> {
          holder[0] =
              Gauge.builder(name, value, AtomicInteger::get)
                  .description(description)
                  .tags(tagPairs)
                  .register(registry)
                  .getId();
          return value;
        },
        ignored -> holder[0]);
  }

  /**
   * Unregisters every meter tagged with {@code connectionName} and forgets it.
   *
   * @return number of meters removed
   */
  int removeConnection(final String connectionName) {
    int removed = 0;

    for (final Map.Entry<String, Meter.Id> entry : ids.entrySet()) {
      final var id = entry.getValue();
      if (!Objects.equals(connectionName, id.getTag(TAG_CONNECTION_NAME))) {
        continue;
      }

      final var key = entry.getKey();
      try {
        registry.remove(id);
      } catch (final RuntimeException ex) {
        log.warn("Failed to remove meter {}: {}", key, ex.getMessage());
        continue;
      }

      ids.remove(key);
      if (counters.remove(key) != null
          || timers.remove(key) != null
          || gaugeValues.remove(key) != null) {
        cacheSize.decrementAndGet();
      }
      removed++;
    }

    if (log.isDebugEnabled()) {
      log.debug("Removed {} meter(s) for connection '{}'", removed, connectionName);
    }
    return removed;
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  // ==================== Private Methods ====================

  private <M> M getOrCreate(
      final ConcurrentHashMap<String, M> cache,
      final String name,
      final String[] tagPairs,
      final Supplier<M> factory,
      final Function<M, Meter.Id> idOf) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = cache.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() >= maxCacheSize) {
      log.warn("Metric cache full at {} entries. Direct registry used for: {}", maxCacheSize, key);
      return factory.get();
    }

    return cache.computeIfAbsent(
        key,
        k -> {
          final var created = factory.get();
          cacheSize.incrementAndGet();
          ids.put(k, idOf.apply(created));
          return created;
        });
  }

  private static String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + tagPairs.length * 12);
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private static void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }
}
