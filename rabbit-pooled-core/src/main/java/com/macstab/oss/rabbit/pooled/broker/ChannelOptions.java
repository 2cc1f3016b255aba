/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.rabbit.pooled.broker;

import lombok.Builder;
import lombok.Value;

/** Options passed verbatim to {@link BrokerConnection#openChannel(ChannelOptions)}. */
@Value
@Builder
public class ChannelOptions {

  public static final ChannelOptions DEFAULTS = ChannelOptions.builder().build();

  /** Requested channel number, {@code null} lets the broker assign one. */
  Integer channelNumber;

  /** Put the channel into confirm mode. */
  @Builder.Default boolean publisherConfirms = true;

  /** Raise on messages the broker returns as unroutable. */
  @Builder.Default boolean onReturnRaises = false;
}
