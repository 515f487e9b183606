package com.openstable.sync.subscription;

import com.openstable.sync.codec.EntityCodec;
import com.openstable.sync.filter.FilterDescriptor;
import com.openstable.sync.model.SyncEntity;
import com.openstable.sync.support.BackoffRetrier;
import com.openstable.sync.transport.ChangeFeedTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;

/**
 * Entry point for live subscriptions. Subscriptions with the same collection and filter
 * share one transport channel; each gets its own handlers, metrics and lifecycle.
 */
@Slf4j
public class SubscriptionManager implements AutoCloseable {

    private final ChangeFeedTransport transport;
    private final BackoffRetrier retrier;
    private final Clock clock;
    private final ChannelRegistry registry = new ChannelRegistry();

    public SubscriptionManager(ChangeFeedTransport transport, BackoffRetrier retrier, TaskScheduler scheduler) {
        this.transport = transport;
        this.retrier = retrier;
        this.clock = scheduler.getClock();
    }

    public <T extends SyncEntity> Subscription<T> subscribe(FilterDescriptor filter, EntityCodec<T> codec,
                                                            ChangeHandler<T> handler) {
        return subscribe(filter, codec, handler, SubscriptionOptions.defaults());
    }

    /**
     * Registers a handler for the changes of {@code filter.collection()} that match the filter.
     * Returns immediately; the connection state is reported through the handler and
     * {@link Subscription#connection()}.
     */
    public <T extends SyncEntity> Subscription<T> subscribe(FilterDescriptor filter, EntityCodec<T> codec,
                                                            ChangeHandler<T> handler, SubscriptionOptions options) {
        options.validate();
        String id = filter.collection() + "_" + filter.hash() + "_" + clock.millis();
        Subscription<T> subscription = registry.register(filter,
                channelFilter -> new ManagedChannel(channelFilter, transport, retrier, options.getRetry(), clock),
                channel -> new Subscription<>(id, filter, codec, options.getEvents(), handler, channel, clock,
                        released -> registry.release(channel, released)));
        log.info("Subscription {} registered on {}", id, filter);
        subscription.connect();
        return subscription;
    }

    public ChannelRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        log.info("Closing {} channels", registry.size());
        registry.closeAll();
    }
}
