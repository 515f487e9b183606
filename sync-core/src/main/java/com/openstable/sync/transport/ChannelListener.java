package com.openstable.sync.transport;

import com.openstable.sync.model.RawChangeEvent;

public interface ChannelListener {

    void onEvent(RawChangeEvent event);

    /**
     * The channel dropped after it had been established. No further events arrive on it.
     */
    void onDisconnect(Throwable cause);
}
