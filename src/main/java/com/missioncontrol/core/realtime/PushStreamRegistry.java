package com.missioncontrol.core.realtime;

import com.missioncontrol.core.config.RealtimeProperties;
import com.missioncontrol.core.metrics.RealtimeMetrics;
import com.missioncontrol.core.realtime.message.ConnectedPayload;
import com.missioncontrol.core.realtime.message.EventEnvelope;
import com.missioncontrol.core.realtime.message.EventType;
import com.missioncontrol.core.realtime.message.PingPayload;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongFunction;

/**
 * Broadcast-only push streams (server-sent events) with no subscription filtering.
 * <p>
 * Every open stream receives every envelope passed to {@link #publishAll}. A stream whose
 * send fails is dropped from the registry; the servlet container completes the emitter
 * itself once it observes the broken connection.
 * <p>
 * Between {@link #start()} and {@link #stop()} a {@code ping} envelope goes to every stream at
 * the heartbeat interval, serialized like any other envelope so clients can parse it the
 * same way.
 */
@Service
public class PushStreamRegistry {

    private static final Logger log = LoggerFactory.getLogger(PushStreamRegistry.class);

    private final EnvelopeCodec codec;
    private final RealtimeProperties properties;
    private final RealtimeMetrics metrics;
    private final LongFunction<SseEmitter> emitterFactory;

    private final Map<String, PushStream> streams = new ConcurrentHashMap<>();
    private final AtomicLong streamIdCounter = new AtomicLong();

    private volatile ScheduledExecutorService heartbeatScheduler;

    @Autowired
    public PushStreamRegistry(EnvelopeCodec codec, RealtimeProperties properties, RealtimeMetrics metrics) {
        this(codec, properties, metrics, SseEmitter::new);
    }

    PushStreamRegistry(EnvelopeCodec codec, RealtimeProperties properties, RealtimeMetrics metrics,
                       LongFunction<SseEmitter> emitterFactory) {
        this.codec = codec;
        this.properties = properties;
        this.metrics = metrics;
        this.emitterFactory = emitterFactory;
        metrics.registerConnectionGauge(RealtimeMetrics.STREAM, streams::size);
    }

    @PostConstruct
    public synchronized void start() {
        if (heartbeatScheduler != null) {
            return;
        }
        heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sse-heartbeat");
            t.setDaemon(true);
            return t;
        });
        long interval = properties.getHeartbeatIntervalSeconds();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, interval, interval, TimeUnit.SECONDS);
        log.info("Push stream registry started (heartbeat={}s)", interval);
    }

    @PreDestroy
    public synchronized void stop() {
        ScheduledExecutorService scheduler = heartbeatScheduler;
        if (scheduler == null) {
            return;
        }
        heartbeatScheduler = null;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        int open = streams.size();
        streams.values().forEach(stream -> stream.emitter().complete());
        streams.clear();
        log.info("Push stream registry stopped ({} stream(s) completed)", open);
    }

    public boolean isRunning() {
        return heartbeatScheduler != null;
    }

    /**
     * Opens a stream and immediately sends it a {@code connected} envelope.
     */
    public PushStream register() {
        String streamId = "stream_" + streamIdCounter.incrementAndGet();
        SseEmitter emitter = emitterFactory.apply(properties.getStreamTimeoutMs());
        var stream = new PushStream(streamId, emitter);
        streams.put(streamId, stream);

        emitter.onCompletion(() -> {
            log.debug("Push stream {} completed", streamId);
            close(streamId);
        });
        emitter.onTimeout(() -> {
            log.debug("Push stream {} timed out", streamId);
            close(streamId);
        });
        emitter.onError(ex -> {
            log.debug("Push stream {} error: {}", streamId, ex.getMessage());
            close(streamId);
        });

        Instant now = Instant.now();
        var connected = new EventEnvelope(EventType.CONNECTED, new ConnectedPayload(streamId, now), now);
        send(stream, codec.encode(connected));

        log.info("Push stream opened: {} ({} total)", streamId, streams.size());
        return stream;
    }

    /**
     * Sends the same serialized envelope to every open stream.
     *
     * @return number of streams the frame was handed to
     */
    public int publishAll(EventEnvelope envelope) {
        String frame;
        try {
            frame = codec.encode(envelope);
        } catch (RuntimeException e) {
            log.error("Dropping {} envelope that could not be encoded", envelope.type().wireName(), e);
            return 0;
        }

        int delivered = 0;
        for (PushStream stream : streams.values()) {
            if (send(stream, frame)) {
                delivered++;
            }
        }
        metrics.recordBroadcast(RealtimeMetrics.STREAM, envelope.type().wireName(), delivered);
        if (delivered > 0) {
            log.debug("Pushed {} to {} stream(s)", envelope.type().wireName(), delivered);
        }
        return delivered;
    }

    /**
     * Forgets a stream. Unknown ids are ignored.
     */
    public void close(String streamId) {
        if (streams.remove(streamId) != null) {
            log.info("Push stream closed: {} ({} remaining)", streamId, streams.size());
        }
    }

    public int activeStreamCount() {
        return streams.size();
    }

    void sendHeartbeats() {
        if (streams.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        String frame = codec.encode(new EventEnvelope(EventType.PING, new PingPayload(now), now));
        log.debug("Sending ping to {} push stream(s)", streams.size());
        for (PushStream stream : streams.values()) {
            send(stream, frame);
        }
    }

    private boolean send(PushStream stream, String frame) {
        try {
            stream.emitter().send(SseEmitter.event().data(frame));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Push to {} failed (connection likely closed): {}", stream.id(), e.getMessage());
            metrics.recordDeliveryFailure(RealtimeMetrics.STREAM);
            close(stream.id());
            return false;
        }
    }

    /**
     * Handle of one open push stream.
     */
    public record PushStream(String id, SseEmitter emitter) {}
}
