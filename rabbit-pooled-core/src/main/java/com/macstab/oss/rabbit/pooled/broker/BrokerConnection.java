/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.broker;

import com.macstab.oss.rabbit.pooled.exception.ChannelCreationException;
import com.macstab.oss.rabbit.pooled.pool.PoolableResource;

/**
 * Live session to the broker.
 *
 * <p>Owned by exactly one connection pool slot. Channels opened through it outlive the borrow
 * that created them.
 */
public interface BrokerConnection extends PoolableResource {

  /**
   * Opens a channel multiplexed over this connection.
   *
   * @throws ChannelCreationException the broker refused or failed to open the channel
   */
  BrokerChannel openChannel(ChannelOptions options);
}
