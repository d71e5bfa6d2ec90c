package com.missioncontrol.core.health;

import com.missioncontrol.core.realtime.PushStreamRegistry;
import com.missioncontrol.core.realtime.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final SubscriptionRegistry subscriptionRegistry;
    private final PushStreamRegistry pushStreamRegistry;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) SubscriptionRegistry subscriptionRegistry,
            @Autowired(required = false) PushStreamRegistry pushStreamRegistry) {
        this.dataSource = dataSource;
        this.subscriptionRegistry = subscriptionRegistry;
        this.pushStreamRegistry = pushStreamRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkSocketRegistry());
        results.add(checkPushStreams());
        return results;
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.down("database", "No DataSource configured");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid", Map.of());
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }

    private HealthStatus checkSocketRegistry() {
        if (subscriptionRegistry == null) {
            return HealthStatus.down("websocket", "Subscription registry not available");
        }
        String clients = String.valueOf(subscriptionRegistry.connectionCount());
        if (!subscriptionRegistry.isRunning()) {
            return HealthStatus.degraded("websocket", "Subscription registry stopped", Map.of("clients", clients));
        }
        return HealthStatus.up("websocket", clients + " client(s) connected", Map.of("clients", clients));
    }

    private HealthStatus checkPushStreams() {
        if (pushStreamRegistry == null) {
            return HealthStatus.down("sse", "Push stream registry not available");
        }
        String streams = String.valueOf(pushStreamRegistry.activeStreamCount());
        if (!pushStreamRegistry.isRunning()) {
            return HealthStatus.degraded("sse", "Push stream registry stopped", Map.of("streams", streams));
        }
        return HealthStatus.up("sse", streams + " stream(s) open", Map.of("streams", streams));
    }
}
