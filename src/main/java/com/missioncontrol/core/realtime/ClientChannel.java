package com.missioncontrol.core.realtime;

import java.io.IOException;

/**
 * Live transport handle of one subscription connection. Owned by the
 * {@link SubscriptionRegistry} from registration until the connection goes away.
 * <p>
 * {@link #send} and {@link #sendHeartbeat} are called while the router holds its publish
 * lock and must not block on the network; wrap blocking transports in a
 * {@link QueuedClientChannel}.
 */
public interface ClientChannel {

    boolean isOpen();

    /**
     * Queues one text frame for the client.
     *
     * @throws IOException if the connection is closed or its outbound queue overflowed
     */
    void send(String frame) throws IOException;

    /** Sends a transport-level keepalive. */
    void sendHeartbeat() throws IOException;

    /** Closes the transport; safe to call on an already closed channel. */
    void close();
}
