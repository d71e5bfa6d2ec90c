package com.missioncontrol.core.realtime;

import com.missioncontrol.core.metrics.RealtimeMetrics;
import com.missioncontrol.core.realtime.message.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fans an envelope out to the subscription connections selected by a {@link BroadcastScope}.
 * <p>
 * Publishes are applied one at a time, so every connection sees envelopes in publish-call
 * order. Each selected connection receives a publish at most once even when it matches both
 * the workspace and the task. A failed send drops that one connection and is never reported
 * to the publisher.
 * <p>
 * The publish lock only covers handing frames to each channel, which must not block on the
 * network (see {@link QueuedClientChannel}). Failed connections are unregistered and closed
 * after the lock is released.
 */
@Service
public class BroadcastRouter {

    private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

    private final SubscriptionRegistry registry;
    private final EnvelopeCodec codec;
    private final RealtimeMetrics metrics;
    private final ReentrantLock publishLock = new ReentrantLock();

    public BroadcastRouter(SubscriptionRegistry registry, EnvelopeCodec codec, RealtimeMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Delivers {@code envelope} to every connection in scope.
     *
     * @return number of connections the frame was handed to
     */
    public int publish(EventEnvelope envelope, BroadcastScope scope) {
        String frame;
        try {
            frame = codec.encode(envelope);
        } catch (RuntimeException e) {
            log.error("Dropping {} envelope that could not be encoded", envelope.type().wireName(), e);
            return 0;
        }

        int delivered = 0;
        Map<String, ClientChannel> failed = new LinkedHashMap<>();
        publishLock.lock();
        try {
            Map<String, ClientChannel> targets = new LinkedHashMap<>();
            registry.forEachMatching(scope, targets::putIfAbsent);
            if (scope.kind() == BroadcastScope.Kind.TASK) {
                registry.forEachSubscribedToTask(scope.taskId(), targets::putIfAbsent);
            }

            for (Map.Entry<String, ClientChannel> target : targets.entrySet()) {
                if (offer(target.getKey(), target.getValue(), frame)) {
                    delivered++;
                } else {
                    failed.put(target.getKey(), target.getValue());
                }
            }
        } finally {
            publishLock.unlock();
        }
        failed.forEach(this::drop);

        metrics.recordBroadcast(RealtimeMetrics.SOCKET, envelope.type().wireName(), delivered);
        if (delivered > 0) {
            log.debug("Broadcast {} to {} client(s)", envelope.type().wireName(), delivered);
        }
        return delivered;
    }

    /**
     * Sends one envelope to a single connection, e.g. an ack or an error reply.
     *
     * @return false if the connection could not be written to and was dropped
     */
    public boolean sendTo(String clientId, ClientChannel channel, EventEnvelope envelope) {
        String frame = codec.encode(envelope);
        boolean offered;
        publishLock.lock();
        try {
            offered = offer(clientId, channel, frame);
        } finally {
            publishLock.unlock();
        }
        if (!offered) {
            drop(clientId, channel);
        }
        return offered;
    }

    private boolean offer(String clientId, ClientChannel channel, String frame) {
        if (!channel.isOpen()) {
            return false;
        }
        try {
            channel.send(frame);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Send to {} failed, dropping connection: {}", clientId, e.getMessage());
            metrics.recordDeliveryFailure(RealtimeMetrics.SOCKET);
            return false;
        }
    }

    private void drop(String clientId, ClientChannel channel) {
        registry.unregister(clientId);
        channel.close();
    }
}
