package com.missioncontrol.core.realtime;

import com.missioncontrol.core.config.RealtimeProperties;
import com.missioncontrol.core.metrics.RealtimeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private SimpleMeterRegistry meterRegistry;
    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new SubscriptionRegistry(new RealtimeProperties(), new RealtimeMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        registry.stop();
    }

    private List<String> matching(BroadcastScope scope) {
        List<String> ids = new ArrayList<>();
        registry.forEachMatching(scope, (id, channel) -> ids.add(id));
        return ids;
    }

    private List<String> subscribedToTask(String taskId) {
        List<String> ids = new ArrayList<>();
        registry.forEachSubscribedToTask(taskId, (id, channel) -> ids.add(id));
        return ids;
    }

    @Nested
    @DisplayName("register / unregister")
    class LifecycleTests {

        @Test
        @DisplayName("new connections get distinct ids and the default workspace")
        void registerAssignsIdAndDefaultWorkspace() {
            String first = registry.register(new RecordingChannel());
            String second = registry.register(new RecordingChannel());

            assertNotEquals(first, second);
            assertEquals(Set.of("default"), registry.filtersOf(first).orElseThrow().workspaces());
            assertTrue(registry.filtersOf(first).orElseThrow().tasks().isEmpty());
            assertEquals(2, registry.connectionCount());
        }

        @Test
        @DisplayName("default workspace follows configuration")
        void defaultWorkspaceIsConfigurable() {
            var properties = new RealtimeProperties();
            properties.setDefaultWorkspace("ops");
            var custom = new SubscriptionRegistry(properties, new RealtimeMetrics(new SimpleMeterRegistry()));

            String id = custom.register(new RecordingChannel());

            assertEquals(Set.of("ops"), custom.filtersOf(id).orElseThrow().workspaces());
        }

        @Test
        @DisplayName("unregister is idempotent")
        void unregisterIsIdempotent() {
            String id = registry.register(new RecordingChannel());
            registry.register(new RecordingChannel());

            assertTrue(registry.unregister(id));
            assertFalse(registry.unregister(id));
            assertFalse(registry.unregister(id));
            assertFalse(registry.unregister("client_unknown"));

            assertEquals(1, registry.connectionCount());
            assertTrue(registry.filtersOf(id).isEmpty());
            assertFalse(matching(BroadcastScope.all()).contains(id));
        }

        @Test
        @DisplayName("connection gauge tracks live connections")
        void gaugeTracksConnections() {
            String id = registry.register(new RecordingChannel());
            registry.register(new RecordingChannel());
            registry.unregister(id);

            var gauge = meterRegistry.find("missioncontrol.connections.active").tag("transport", "socket").gauge();
            assertNotNull(gauge);
            assertEquals(1.0, gauge.value());
        }

        @Test
        @DisplayName("stop closes every channel and empties the registry")
        void stopClosesChannels() {
            registry.start();
            var a = new RecordingChannel();
            var b = new RecordingChannel();
            registry.register(a);
            registry.register(b);

            registry.stop();

            assertFalse(registry.isRunning());
            assertEquals(0, registry.connectionCount());
            assertFalse(a.isOpen());
            assertFalse(b.isOpen());
        }
    }

    @Nested
    @DisplayName("subscription filters")
    class FilterTests {

        @Test
        @DisplayName("subscribe unions ids; unsubscribe removes them")
        void subscribeAndUnsubscribe() {
            String id = registry.register(new RecordingChannel());

            registry.subscribe(id, List.of("alpha", "beta"), List.of("t1"));
            registry.subscribe(id, List.of("alpha"), List.of("t2"));
            var filters = registry.unsubscribe(id, List.of("default", "beta"), List.of("t1")).orElseThrow();

            assertEquals(Set.of("alpha"), filters.workspaces());
            assertEquals(Set.of("t2"), filters.tasks());
        }

        @Test
        @DisplayName("subscribe on an unknown connection is a no-op")
        void subscribeUnknownConnection() {
            assertTrue(registry.subscribe("client_404", List.of("alpha"), List.of()).isEmpty());
            assertTrue(registry.unsubscribe("client_404", List.of("alpha"), List.of()).isEmpty());
            assertEquals(0, registry.connectionCount());
        }

        @Test
        @DisplayName("workspace match holds iff the workspace or the wildcard is subscribed")
        void workspaceMatchTracksFilterSet() {
            String id = registry.register(new RecordingChannel());
            BroadcastScope alpha = BroadcastScope.workspace("alpha");

            assertFalse(matching(alpha).contains(id));

            registry.subscribe(id, List.of("alpha"), List.of());
            assertTrue(matching(alpha).contains(id));

            registry.unsubscribe(id, List.of("alpha"), List.of());
            assertFalse(matching(alpha).contains(id));

            registry.subscribe(id, List.of(SubscriptionRegistry.WILDCARD), List.of());
            assertTrue(matching(alpha).contains(id));
            assertTrue(matching(BroadcastScope.workspace("anything")).contains(id));

            registry.subscribe(id, List.of("alpha"), List.of());
            registry.unsubscribe(id, List.of(SubscriptionRegistry.WILDCARD), List.of());
            assertTrue(matching(alpha).contains(id));
            assertFalse(matching(BroadcastScope.workspace("anything")).contains(id));
        }

        @Test
        @DisplayName("a task-only subscriber is not matched by workspace scope")
        void taskOnlySubscriberNotMatchedByWorkspace() {
            String id = registry.register(new RecordingChannel());
            registry.unsubscribe(id, List.of("default"), List.of());
            registry.subscribe(id, List.of(), List.of("t1"));

            assertFalse(matching(BroadcastScope.workspace("default")).contains(id));
            assertEquals(List.of(id), subscribedToTask("t1"));
            assertTrue(subscribedToTask("t2").isEmpty());
        }

        @Test
        @DisplayName("the all scope matches every connection")
        void allScopeMatchesEveryone() {
            String a = registry.register(new RecordingChannel());
            String b = registry.register(new RecordingChannel());
            registry.unsubscribe(b, List.of("default"), List.of());

            assertEquals(List.of(a, b), matching(BroadcastScope.all()));
        }
    }

    @Nested
    @DisplayName("heartbeat")
    class HeartbeatTests {

        @Test
        @DisplayName("sends a heartbeat to every live connection")
        void heartbeatReachesEveryone() {
            var a = new RecordingChannel();
            var b = new RecordingChannel();
            registry.register(a);
            registry.register(b);

            registry.sendHeartbeats();

            assertEquals(1, a.heartbeats());
            assertEquals(1, b.heartbeats());
        }

        @Test
        @DisplayName("drops connections whose heartbeat fails or that are already closed")
        void heartbeatDropsDeadConnections() {
            var healthy = new RecordingChannel();
            var broken = new RecordingChannel().failingSends();
            var closed = new RecordingChannel();
            String healthyId = registry.register(healthy);
            registry.register(broken);
            registry.register(closed);
            closed.markClosed();

            registry.sendHeartbeats();

            assertEquals(List.of(healthyId), matching(BroadcastScope.all()));
            assertEquals(1, broken.closeCalls());
        }
    }
}
