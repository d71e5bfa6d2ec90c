package com.missioncontrol.dispatch.api;

import com.missioncontrol.core.realtime.PushStreamRegistry;
import com.missioncontrol.core.realtime.SubscriptionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class RealtimeStatusController {

    private final SubscriptionRegistry subscriptionRegistry;
    private final PushStreamRegistry pushStreamRegistry;

    public RealtimeStatusController(SubscriptionRegistry subscriptionRegistry, PushStreamRegistry pushStreamRegistry) {
        this.subscriptionRegistry = subscriptionRegistry;
        this.pushStreamRegistry = pushStreamRegistry;
    }

    /**
     * GET /api/ws/status: Live connection counts for both transports.
     */
    @GetMapping("/api/ws/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("running", subscriptionRegistry.isRunning());
        result.put("clients", subscriptionRegistry.connectionCount());
        result.put("streams", pushStreamRegistry.activeStreamCount());
        return ResponseEntity.ok(result);
    }
}
