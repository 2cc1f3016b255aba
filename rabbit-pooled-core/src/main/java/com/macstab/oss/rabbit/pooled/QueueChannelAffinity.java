/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled;

import static lombok.AccessLevel.PRIVATE;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import com.macstab.oss.rabbit.pooled.broker.BrokerChannel;
import com.macstab.oss.rabbit.pooled.exception.PoolAcquireInterruptedException;
import com.macstab.oss.rabbit.pooled.exception.PoolClosedException;
import com.macstab.oss.rabbit.pooled.metrics.PooledRabbitMetrics;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Sticky queue-name → channel map, held outside the shared channel pool's rotation.
 *
 * <p><strong>Atomic get-or-create per queue:</strong> entries are futures. The first caller for a
 * queue name wins {@code putIfAbsent}, takes a channel from the pool (unscoped) and completes the
 * future; concurrent callers for the same name wait on that future instead of taking a second
 * channel. No map lock is held during channel creation, so other queue names are not blocked.
 *
 * <p><strong>Failure:</strong> the winner removes its entry before completing exceptionally, so
 * the next call retries creation. Waiters receive the winner's exception unmodified.
 *
 * <p><strong>Ownership:</strong> a pinned channel is never returned to the channel pool. It is
 * closed by {@link #closeAll()}, which the manager runs before closing the pools.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class QueueChannelAffinity {

  ChannelPool channelPool;
  PooledRabbitMetrics metrics;
  String connectionName;
  ConcurrentHashMap<String, CompletableFuture<BrokerChannel>> channels;

  @NonFinal volatile boolean closed;

  public QueueChannelAffinity(
      @NonNull final ChannelPool channelPool,
      @NonNull final PooledRabbitMetrics metrics,
      @NonNull final String connectionName) {
    this.channelPool = channelPool;
    this.metrics = metrics;
    this.connectionName = connectionName;
    this.channels = new ConcurrentHashMap<>();
  }

  /**
   * Returns the channel pinned to {@code queueName}, pinning a new one on first use.
   *
   * @throws PoolClosedException the affinity map or the channel pool is closed
   */
  public BrokerChannel channelFor(@NonNull final String queueName) {
    checkNotClosed();

    final var existing = channels.get(queueName);
    if (existing != null) {
      return join(existing);
    }

    final var pending = new CompletableFuture<BrokerChannel>();
    final var raced = channels.putIfAbsent(queueName, pending);
    if (raced != null) {
      return join(raced);
    }

    final BrokerChannel channel;
    try {
      channel = channelPool.getUnscoped();
    } catch (final RuntimeException | Error ex) {
      channels.remove(queueName, pending);
      pending.completeExceptionally(ex);
      throw ex;
    }

    pending.complete(channel);
    metrics.setQueueChannels(connectionName, channels.size());

    if (log.isDebugEnabled()) {
      log.debug("Pinned {} to queue '{}'", channel, queueName);
    }

    // closeAll() may have run between the check above and the put; it snapshots completed entries
    if (closed) {
      closeIfOpen(queueName, channel);
      throw new PoolClosedException("queue-channels");
    }
    return channel;
  }

  public boolean contains(final String queueName) {
    return channels.containsKey(queueName);
  }

  public int size() {
    return channels.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes every pinned channel that is still open, then forgets all entries. Idempotent.
   *
   * <p>Entries whose creation is still in flight are skipped here; their creator sees the closed
   * flag and closes the channel itself.
   */
  public void closeAll() {
    if (closed) {
      return;
    }
    closed = true;

    int closedCount = 0;
    for (final var entry : channels.entrySet()) {
      final var future = entry.getValue();
      if (future.isDone() && !future.isCompletedExceptionally()) {
        if (closeIfOpen(entry.getKey(), future.join())) {
          closedCount++;
        }
      }
    }
    channels.clear();
    metrics.setQueueChannels(connectionName, 0);

    if (log.isDebugEnabled()) {
      log.debug("Closed {} queue channel(s)", closedCount);
    }
  }

  // ==================== Private Methods ====================

  private void checkNotClosed() {
    if (closed) {
      throw new PoolClosedException("queue-channels");
    }
  }

  private BrokerChannel join(final CompletableFuture<BrokerChannel> future) {
    try {
      return future.get();
    } catch (final InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new PoolAcquireInterruptedException("queue-channels", ex);
    } catch (final ExecutionException ex) {
      throw rethrow(ex.getCause());
    } catch (final CancellationException ex) {
      throw new PoolClosedException("queue-channels");
    }
  }

  private static RuntimeException rethrow(final Throwable cause) {
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new IllegalStateException("Queue channel creation failed", cause);
  }

  private boolean closeIfOpen(final String queueName, final BrokerChannel channel) {
    if (!channel.isOpen()) {
      return false;
    }
    try {
      channel.close();
      return true;
    } catch (final RuntimeException ex) {
      log.warn("Failed to close channel pinned to queue '{}'", queueName, ex);
      return false;
    }
  }
}
