package com.openstable.sync.subscription;

import com.openstable.sync.filter.FilterDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Reference-counted table of shared channels, keyed by collection and filter.
 * A channel is opened by its first subscription and closed when the last one leaves.
 */
@Slf4j
public class ChannelRegistry {

    private final Map<String, ManagedChannel> channels = new LinkedHashMap<>();

    synchronized <S extends Subscription<?>> S register(FilterDescriptor filter,
                                                        Function<FilterDescriptor, ManagedChannel> channelFactory,
                                                        Function<ManagedChannel, S> subscriptionFactory) {
        ManagedChannel channel = channels.computeIfAbsent(filter.channelKey(), key -> {
            log.debug("Creating channel {}", key);
            return channelFactory.apply(filter);
        });
        S subscription = subscriptionFactory.apply(channel);
        channel.attach(subscription);
        return subscription;
    }

    void release(ManagedChannel channel, Subscription<?> subscription) {
        boolean last;
        synchronized (this) {
            last = channel.detach(subscription) == 0 && channels.get(channel.key()) == channel;
            if (last) {
                channels.remove(channel.key());
            }
        }
        // channel lock is taken outside the registry lock; dispatch holds them in the opposite order
        if (last) {
            channel.close();
        }
    }

    public ChannelStats stats() {
        List<ChannelStats.ChannelInfo> details = snapshot().stream().map(ManagedChannel::info).toList();
        int subscriptions = details.stream().mapToInt(ChannelStats.ChannelInfo::subscribers).sum();
        return new ChannelStats(details.size(), subscriptions, details);
    }

    public List<String> disconnectedChannels() {
        return snapshot().stream()
                .filter(channel -> channel.status() == ConnectionStatus.DISCONNECTED)
                .map(ManagedChannel::key)
                .toList();
    }

    /**
     * Starts a fresh connection attempt on every channel that gave up reconnecting.
     */
    public List<CompletableFuture<ConnectionStatus>> reconnectDisconnected() {
        List<ManagedChannel> disconnected = snapshot().stream()
                .filter(channel -> channel.status() == ConnectionStatus.DISCONNECTED)
                .filter(channel -> channel.subscriberCount() > 0)
                .toList();
        List<CompletableFuture<ConnectionStatus>> attempts = new ArrayList<>();
        for (ManagedChannel channel : disconnected) {
            attempts.add(channel.reconnect());
        }
        return attempts;
    }

    public synchronized int size() {
        return channels.size();
    }

    void closeAll() {
        List<ManagedChannel> closing;
        synchronized (this) {
            closing = List.copyOf(channels.values());
            channels.clear();
        }
        closing.forEach(ManagedChannel::close);
    }

    private synchronized List<ManagedChannel> snapshot() {
        return List.copyOf(channels.values());
    }
}
