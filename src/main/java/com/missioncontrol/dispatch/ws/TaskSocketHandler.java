package com.missioncontrol.dispatch.ws;

import com.missioncontrol.core.config.RealtimeProperties;
import com.missioncontrol.core.logging.MdcContext;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.realtime.BroadcastRouter;
import com.missioncontrol.core.realtime.ClientChannel;
import com.missioncontrol.core.realtime.EnvelopeCodec;
import com.missioncontrol.core.realtime.QueuedClientChannel;
import com.missioncontrol.core.realtime.SubscriptionRegistry;
import com.missioncontrol.core.realtime.message.ConnectedPayload;
import com.missioncontrol.core.realtime.message.ErrorPayload;
import com.missioncontrol.core.realtime.message.EventEnvelope;
import com.missioncontrol.core.realtime.message.EventType;
import com.missioncontrol.core.realtime.message.SubscriptionPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Subscription transport endpoint. Each session is registered with the
 * {@link SubscriptionRegistry} on handshake and removed on close or transport error;
 * inbound {@code subscribe}/{@code unsubscribe} frames edit its filters and are acknowledged
 * with a {@code subscribed} envelope listing the filters after the change.
 * <p>
 * Outbound frames go through a per-session {@link QueuedClientChannel}, so socket writes run
 * on that session's writer thread and never on a publishing or handshake thread.
 */
@Component
public class TaskSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TaskSocketHandler.class);

    static final String CLIENT_ID_ATTR = "missionControl.clientId";
    static final String CHANNEL_ATTR = "missionControl.channel";

    private final SubscriptionRegistry registry;
    private final BroadcastRouter router;
    private final EnvelopeCodec codec;
    private final RealtimeProperties properties;

    public TaskSocketHandler(SubscriptionRegistry registry, BroadcastRouter router, EnvelopeCodec codec,
                             RealtimeProperties properties) {
        this.registry = registry;
        this.router = router;
        this.codec = codec;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var channel = new QueuedClientChannel(
                new WebSocketClientChannel(session, properties.getSendTimeLimitMs(), properties.getSendBufferLimitBytes()),
                session.getId(), properties.getSendQueueLimitFrames());
        String clientId = registry.register(channel);
        session.getAttributes().put(CLIENT_ID_ATTR, clientId);
        session.getAttributes().put(CHANNEL_ATTR, channel);

        Instant now = Instant.now();
        router.sendTo(clientId, channel,
                new EventEnvelope(EventType.CONNECTED, new ConnectedPayload(clientId, now), now));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String clientId = (String) session.getAttributes().get(CLIENT_ID_ATTR);
        ClientChannel channel = (ClientChannel) session.getAttributes().get(CHANNEL_ATTR);
        if (clientId == null || channel == null) {
            return;
        }

        MdcContext.setClient(clientId);
        try {
            EventEnvelope inbound;
            try {
                inbound = codec.decodeInbound(message.getPayload());
            } catch (ValidationException e) {
                log.warn("Rejected message from {}: {}", clientId, e.getMessage());
                router.sendTo(clientId, channel, EventEnvelope.of(EventType.ERROR, new ErrorPayload(e.getMessage())));
                return;
            }

            SubscriptionPayload filters = inbound.payloadAs(SubscriptionPayload.class);
            Optional<SubscriptionRegistry.Filters> after = inbound.type() == EventType.SUBSCRIBE
                    ? registry.subscribe(clientId, filters.workspaces(), filters.tasks())
                    : registry.unsubscribe(clientId, filters.workspaces(), filters.tasks());

            after.ifPresent(current -> {
                log.debug("{} {} workspaces={} tasks={}", clientId, inbound.type().wireName(),
                        filters.workspaces(), filters.tasks());
                router.sendTo(clientId, channel, EventEnvelope.of(EventType.SUBSCRIBED,
                        new SubscriptionPayload(new ArrayList<>(current.workspaces()),
                                new ArrayList<>(current.tasks()))));
            });
        } finally {
            MdcContext.clear();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        String clientId = (String) session.getAttributes().get(CLIENT_ID_ATTR);
        log.warn("Transport error on {}: {}", clientId, exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
    }

    private void release(WebSocketSession session) {
        String clientId = (String) session.getAttributes().get(CLIENT_ID_ATTR);
        if (clientId != null) {
            registry.unregister(clientId);
        }
        if (session.getAttributes().get(CHANNEL_ATTR) instanceof ClientChannel channel) {
            channel.close();
        }
    }
}
