package com.chatlive.realtime.ws.backplane;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Single-process mode: there is nobody to relay to.
 */
public class LocalBackplane implements Backplane {

    private final String nodeId = "node_" + UUID.randomUUID();

    @Override
    public void publish(BackplaneEnvelope envelope) {
    }

    @Override
    public void subscribe(Consumer<BackplaneEnvelope> listener) {
    }

    @Override
    public boolean distributed() {
        return false;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }
}
