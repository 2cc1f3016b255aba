/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.broker;

import com.macstab.oss.rabbit.pooled.pool.PoolableResource;

/**
 * Logical session multiplexed over one {@link BrokerConnection}.
 *
 * <p>Owned either by the shared channel pool (lent per scope) or by the queue affinity map
 * (pinned until the manager closes).
 */
public interface BrokerChannel extends PoolableResource {

  /** Channel number assigned by the broker or requested through {@link ChannelOptions}. */
  int getChannelNumber();
}
