package com.missioncontrol.dispatch.ws;

import com.missioncontrol.core.realtime.ClientChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ClientChannel} over a Spring {@link WebSocketSession}.
 * <p>
 * Writes block on the socket, so the handler wraps this channel in a
 * {@link com.missioncontrol.core.realtime.QueuedClientChannel} and only its writer thread
 * calls {@link #send}. The {@link ConcurrentWebSocketSessionDecorator} serializes those writes
 * against the close frame and terminates the session when one write outlasts the time limit
 * or buffered bytes pass the byte limit.
 */
class WebSocketClientChannel implements ClientChannel {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientChannel.class);

    private final WebSocketSession session;

    WebSocketClientChannel(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimitBytes) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimitBytes,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void sendHeartbeat() throws IOException {
        session.sendMessage(new PingMessage());
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
