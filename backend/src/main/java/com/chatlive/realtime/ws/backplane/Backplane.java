package com.chatlive.realtime.ws.backplane;

import java.util.function.Consumer;

public interface Backplane {

    /**
     * Sends the envelope to every other process. Local delivery is the caller's job.
     */
    void publish(BackplaneEnvelope envelope);

    /**
     * Receives envelopes that originated on other processes.
     */
    void subscribe(Consumer<BackplaneEnvelope> listener);

    boolean distributed();

    String nodeId();
}
