package com.missioncontrol.dispatch.api;

import com.missioncontrol.core.realtime.PushStreamRegistry;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Broadcast-only push stream for clients that cannot hold a WebSocket.
 */
@RestController
@RequestMapping("/api/events")
public class EventStreamController {

    private final PushStreamRegistry pushStreams;

    public EventStreamController(PushStreamRegistry pushStreams) {
        this.pushStreams = pushStreams;
    }

    /**
     * GET /api/events/stream: SSE stream of every plan and task event.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream() {
        return ResponseEntity.ok(pushStreams.register().emitter());
    }
}
