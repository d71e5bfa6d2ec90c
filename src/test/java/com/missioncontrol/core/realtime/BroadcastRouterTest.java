package com.missioncontrol.core.realtime;

import com.missioncontrol.core.config.RealtimeProperties;
import com.missioncontrol.core.metrics.RealtimeMetrics;
import com.missioncontrol.core.realtime.message.ErrorPayload;
import com.missioncontrol.core.realtime.message.EventEnvelope;
import com.missioncontrol.core.realtime.message.EventType;
import com.missioncontrol.core.realtime.message.PlanUpdatePayload;
import com.missioncontrol.core.realtime.message.PlanUpdateStatus;
import com.missioncontrol.core.realtime.message.ProgressUpdatePayload;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastRouterTest {

    private SimpleMeterRegistry meterRegistry;
    private SubscriptionRegistry registry;
    private BroadcastRouter router;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        var metrics = new RealtimeMetrics(meterRegistry);
        registry = new SubscriptionRegistry(new RealtimeProperties(), metrics);
        router = new BroadcastRouter(registry, EnvelopeCodec.withDefaults(), metrics);
    }

    private static EventEnvelope planUpdate(String parentId) {
        return EventEnvelope.of(EventType.PLAN_UPDATE,
                new PlanUpdatePayload(parentId, List.of(), PlanUpdateStatus.UPDATED));
    }

    private static EventEnvelope progress(String taskId, int pct) {
        return EventEnvelope.of(EventType.PROGRESS_UPDATE, new ProgressUpdatePayload(taskId, pct, null, null));
    }

    static void awaitFrames(RecordingChannel channel, int count) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
        while (channel.frames().size() < count && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(count, channel.frames().size());
    }

    @Nested
    @DisplayName("scoping")
    class ScopingTests {

        @Test
        @DisplayName("workspace scope reaches only that workspace's subscribers")
        void workspaceScope() {
            var inDefault = new RecordingChannel();
            var inOther = new RecordingChannel();
            registry.register(inDefault);
            String other = registry.register(inOther);
            registry.unsubscribe(other, List.of("default"), List.of());
            registry.subscribe(other, List.of("other"), List.of());

            int delivered = router.publish(planUpdate("t2"), BroadcastScope.workspace("default"));

            assertEquals(1, delivered);
            assertEquals(1, inDefault.frames().size());
            assertTrue(inOther.frames().isEmpty());
        }

        @Test
        @DisplayName("a task-only subscriber does not receive a workspace-scoped plan update")
        void taskOnlySubscriberSkipsWorkspacePublish() {
            var taskOnly = new RecordingChannel();
            String id = registry.register(taskOnly);
            registry.unsubscribe(id, List.of("default"), List.of());
            registry.subscribe(id, List.of(), List.of("t1"));

            router.publish(planUpdate("t2"), BroadcastScope.workspace("default"));
            assertTrue(taskOnly.frames().isEmpty());

            registry.subscribe(id, List.of("default"), List.of());
            router.publish(planUpdate("t2"), BroadcastScope.workspace("default"));
            assertEquals(1, taskOnly.frames().size());
        }

        @Test
        @DisplayName("task scope reaches task subscribers in any workspace")
        void taskScopeReachesTaskSubscribers() {
            var watcher = new RecordingChannel();
            String id = registry.register(watcher);
            registry.unsubscribe(id, List.of("default"), List.of());
            registry.subscribe(id, List.of(), List.of("t1"));

            int delivered = router.publish(progress("t1", 40), BroadcastScope.task("t1", "default"));

            assertEquals(1, delivered);
            assertTrue(watcher.frames().get(0).contains("\"task_id\":\"t1\""));
        }

        @Test
        @DisplayName("a connection matching both workspace and task receives the message once")
        void deduplicatesWorkspaceAndTaskMatches() {
            var both = new RecordingChannel();
            String id = registry.register(both);
            registry.subscribe(id, List.of(), List.of("t1"));

            int delivered = router.publish(progress("t1", 10), BroadcastScope.task("t1", "default"));

            assertEquals(1, delivered);
            assertEquals(1, both.frames().size());
        }

        @Test
        @DisplayName("all scope reaches every connection regardless of filters")
        void allScope() {
            var a = new RecordingChannel();
            var b = new RecordingChannel();
            registry.register(a);
            String idB = registry.register(b);
            registry.unsubscribe(idB, List.of("default"), List.of());

            assertEquals(2, router.publish(planUpdate("t9"), BroadcastScope.all()));
        }
    }

    @Nested
    @DisplayName("delivery")
    class DeliveryTests {

        @Test
        @DisplayName("every receiver gets the identical serialized frame")
        void identicalFrames() {
            var a = new RecordingChannel();
            var b = new RecordingChannel();
            registry.register(a);
            registry.register(b);

            router.publish(planUpdate("p1"), BroadcastScope.workspace("default"));

            assertEquals(a.frames(), b.frames());
            assertTrue(a.frames().get(0).startsWith("{\"type\":\"plan_update\""));
        }

        @Test
        @DisplayName("publish order is preserved per connection")
        void preservesOrder() {
            var channel = new RecordingChannel();
            registry.register(channel);

            for (int i = 0; i <= 100; i += 25) {
                router.publish(progress("t1", i), BroadcastScope.task("t1", "default"));
            }

            assertEquals(5, channel.frames().size());
            for (int i = 0; i < 5; i++) {
                assertTrue(channel.frames().get(i).contains("\"progress\":" + (i * 25)));
            }
        }

        @Test
        @DisplayName("a failing send drops that connection only and is not surfaced")
        void failingSendIsContained() {
            var healthy = new RecordingChannel();
            var broken = new RecordingChannel().failingSends();
            String healthyId = registry.register(healthy);
            String brokenId = registry.register(broken);

            int delivered = assertDoesNotThrow(() ->
                    router.publish(planUpdate("p1"), BroadcastScope.workspace("default")));

            assertEquals(1, delivered);
            assertTrue(registry.filtersOf(brokenId).isEmpty());
            assertTrue(registry.filtersOf(healthyId).isPresent());
            assertFalse(broken.isOpen());
            var failures = meterRegistry.find("missioncontrol.broadcast.failures").tag("transport", "socket").counter();
            assertNotNull(failures);
            assertEquals(1.0, failures.count());
        }

        @Test
        @DisplayName("a connection already closed is skipped and unregistered")
        void closedConnectionIsSkipped() {
            var closed = new RecordingChannel();
            String id = registry.register(closed);
            closed.markClosed();

            assertEquals(0, router.publish(planUpdate("p1"), BroadcastScope.workspace("default")));
            assertTrue(registry.filtersOf(id).isEmpty());
            assertTrue(closed.frames().isEmpty());
        }

        @Test
        @DisplayName("publish with no connections is a no-op")
        void noConnections() {
            assertEquals(0, router.publish(planUpdate("p1"), BroadcastScope.workspace("default")));
            var messages = meterRegistry.find("missioncontrol.broadcast.messages")
                    .tags("transport", "socket", "type", "plan_update").counter();
            assertNotNull(messages);
            assertEquals(1.0, messages.count());
        }

        @Test
        @DisplayName("sendTo targets a single connection")
        void sendToSingleConnection() {
            var a = new RecordingChannel();
            var b = new RecordingChannel();
            String idA = registry.register(a);
            registry.register(b);

            assertTrue(router.sendTo(idA, a, EventEnvelope.of(EventType.ERROR, new ErrorPayload("nope"))));

            assertEquals(1, a.frames().size());
            assertTrue(b.frames().isEmpty());
        }
    }

    @Nested
    @DisplayName("slow consumers")
    class SlowConsumerTests {

        private final CountDownLatch release = new CountDownLatch(1);

        @AfterEach
        void openGate() {
            release.countDown();
        }

        @Test
        @DisplayName("a blocked connection in one workspace does not delay a publish to another")
        void blockedConnectionDoesNotDelayOtherWorkspace() {
            var stuck = new RecordingChannel().blockingUntil(release);
            String slowId = registry.register(new QueuedClientChannel(stuck, "slow", 8));
            registry.subscribe(slowId, List.of("ws-a"), List.of());
            var fast = new RecordingChannel();
            String fastId = registry.register(fast);
            registry.unsubscribe(fastId, List.of("default"), List.of());
            registry.subscribe(fastId, List.of("ws-b"), List.of());

            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
                assertEquals(1, router.publish(planUpdate("p1"), BroadcastScope.workspace("ws-a")));
                assertEquals(1, router.publish(planUpdate("p1"), BroadcastScope.workspace("ws-a")));
                assertEquals(1, router.publish(planUpdate("p2"), BroadcastScope.workspace("ws-b")));
            });

            assertEquals(1, fast.frames().size());
            assertTrue(fast.frames().get(0).contains("\"parent_task_id\":\"p2\""));
            assertTrue(stuck.frames().isEmpty());
            assertTrue(registry.filtersOf(slowId).isPresent());
        }

        @Test
        @DisplayName("frames held behind a slow write are flushed in publish order")
        void drainsInPublishOrder() throws Exception {
            var stuck = new RecordingChannel().blockingUntil(release);
            registry.register(new QueuedClientChannel(stuck, "slow", 16));

            for (int i = 0; i <= 100; i += 25) {
                router.publish(progress("t1", i), BroadcastScope.task("t1", "default"));
            }
            release.countDown();

            awaitFrames(stuck, 5);
            for (int i = 0; i < 5; i++) {
                assertTrue(stuck.frames().get(i).contains("\"progress\":" + (i * 25)));
            }
        }

        @Test
        @DisplayName("overflowing a connection's queue unregisters and closes it without failing the publish")
        void overflowDropsConnection() {
            var stuck = new RecordingChannel().blockingUntil(release);
            var slow = new QueuedClientChannel(stuck, "slow", 2);
            String slowId = registry.register(slow);
            var healthy = new RecordingChannel();
            String healthyId = registry.register(healthy);

            // one frame in flight on the writer, two waiting behind it
            for (int i = 0; i < 3; i++) {
                assertEquals(2, router.publish(planUpdate("p" + i), BroadcastScope.workspace("default")));
            }
            int delivered = assertDoesNotThrow(() ->
                    router.publish(planUpdate("p3"), BroadcastScope.workspace("default")));

            assertEquals(1, delivered);
            assertTrue(registry.filtersOf(slowId).isEmpty());
            assertTrue(registry.filtersOf(healthyId).isPresent());
            assertFalse(slow.isOpen());
            assertEquals(4, healthy.frames().size());
            var failures = meterRegistry.find("missioncontrol.broadcast.failures").tag("transport", "socket").counter();
            assertNotNull(failures);
            assertEquals(1.0, failures.count());
        }
    }
}
