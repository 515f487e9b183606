package com.openstable.sync.subscription;

import java.time.Instant;
import java.util.List;

public record ChannelStats(int channels, int subscriptions, List<ChannelInfo> details) {

    public record ChannelInfo(
            String key,
            String collection,
            ConnectionStatus status,
            int subscribers,
            Instant lastActivity,
            int reconnects
    ) {
    }
}
