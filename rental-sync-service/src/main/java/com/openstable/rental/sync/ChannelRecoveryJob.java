package com.openstable.rental.sync;

import com.openstable.sync.subscription.ChannelStats;
import com.openstable.sync.subscription.SubscriptionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scheduled job that reconnects channels which gave up after exhausting their retry budget.
 * Each reconnect starts with a fresh budget, so a long outage ends in recovery instead of a dead view.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChannelRecoveryJob {

    private final SubscriptionManager subscriptionManager;

    @Value("${stable.sync.channels.recovery-enabled:true}")
    private boolean recoveryEnabled;

    @Scheduled(fixedDelayString = "${stable.sync.channels.recovery-interval-ms:60000}",
            initialDelayString = "${stable.sync.channels.recovery-interval-ms:60000}")
    public void recoverDisconnectedChannels() {
        if (!recoveryEnabled) return;
        List<String> disconnected = subscriptionManager.getRegistry().disconnectedChannels();
        if (disconnected.isEmpty()) return;
        log.info("Channel recovery: reconnecting {} channel(s): {}", disconnected.size(), disconnected);
        try {
            subscriptionManager.getRegistry().reconnectDisconnected();
        } catch (RuntimeException e) {
            log.error("Channel recovery failed", e);
        }
        ChannelStats stats = subscriptionManager.getRegistry().stats();
        log.debug("Channel registry: {} channel(s), {} subscription(s)", stats.channels(), stats.subscriptions());
    }
}
