package com.missioncontrol.core.realtime;

import com.missioncontrol.core.config.RealtimeProperties;
import com.missioncontrol.core.metrics.RealtimeMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * Tracks every live subscription connection with its workspace and task filters.
 * <p>
 * All connection state sits behind one lock. Iteration callbacks run while the lock is held,
 * so they must only collect or enqueue, never block on I/O. Each new connection starts
 * subscribed to the configured default workspace; the workspace filter {@value #WILDCARD}
 * matches every workspace.
 * <p>
 * A heartbeat is pushed to every connection at a fixed interval between {@link #start()}
 * and {@link #stop()}. A connection whose heartbeat fails is dropped.
 */
@Service
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    public static final String WILDCARD = "*";

    private final RealtimeProperties properties;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final AtomicLong clientIdCounter = new AtomicLong();

    private ScheduledExecutorService heartbeatScheduler;

    public SubscriptionRegistry(RealtimeProperties properties, RealtimeMetrics metrics) {
        this.properties = properties;
        metrics.registerConnectionGauge(RealtimeMetrics.SOCKET, this::connectionCount);
    }

    @PostConstruct
    public void start() {
        lock.lock();
        try {
            if (heartbeatScheduler != null) {
                return;
            }
            heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "ws-heartbeat");
                t.setDaemon(true);
                return t;
            });
        } finally {
            lock.unlock();
        }
        long interval = properties.getHeartbeatIntervalSeconds();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, interval, interval, TimeUnit.SECONDS);
        log.info("Subscription registry started (heartbeat={}s, default workspace '{}')",
                interval, properties.getDefaultWorkspace());
    }

    @PreDestroy
    public void stop() {
        ScheduledExecutorService scheduler;
        List<ClientChannel> open;
        lock.lock();
        try {
            scheduler = heartbeatScheduler;
            heartbeatScheduler = null;
            open = new ArrayList<>();
            connections.values().forEach(c -> open.add(c.channel));
            connections.clear();
        } finally {
            lock.unlock();
        }
        if (scheduler == null) {
            return;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        open.forEach(ClientChannel::close);
        log.info("Subscription registry stopped ({} connection(s) closed)", open.size());
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return heartbeatScheduler != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a connection subscribed to the default workspace.
     *
     * @return a fresh client id
     */
    public String register(ClientChannel channel) {
        String clientId = "client_" + clientIdCounter.incrementAndGet();
        int total;
        lock.lock();
        try {
            var connection = new Connection(channel);
            connection.workspaces.add(properties.getDefaultWorkspace());
            connections.put(clientId, connection);
            total = connections.size();
        } finally {
            lock.unlock();
        }
        log.info("Client connected: {} ({} total)", clientId, total);
        return clientId;
    }

    /**
     * Removes a connection. Unknown or already removed ids are ignored.
     *
     * @return true if this call removed the connection
     */
    public boolean unregister(String clientId) {
        int remaining;
        lock.lock();
        try {
            if (connections.remove(clientId) == null) {
                return false;
            }
            remaining = connections.size();
        } finally {
            lock.unlock();
        }
        log.info("Client disconnected: {} ({} remaining)", clientId, remaining);
        return true;
    }

    /**
     * Adds the given ids to a connection's filters.
     *
     * @return the filters after the change, or empty if the connection is unknown
     */
    public Optional<Filters> subscribe(String clientId, Collection<String> workspaceIds, Collection<String> taskIds) {
        lock.lock();
        try {
            Connection connection = connections.get(clientId);
            if (connection == null) {
                return Optional.empty();
            }
            connection.workspaces.addAll(workspaceIds);
            connection.tasks.addAll(taskIds);
            return Optional.of(connection.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the given ids from a connection's filters.
     *
     * @return the filters after the change, or empty if the connection is unknown
     */
    public Optional<Filters> unsubscribe(String clientId, Collection<String> workspaceIds, Collection<String> taskIds) {
        lock.lock();
        try {
            Connection connection = connections.get(clientId);
            if (connection == null) {
                return Optional.empty();
            }
            connection.workspaces.removeAll(workspaceIds);
            connection.tasks.removeAll(taskIds);
            return Optional.of(connection.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Filters> filtersOf(String clientId) {
        lock.lock();
        try {
            return Optional.ofNullable(connections.get(clientId)).map(Connection::snapshot);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Invokes {@code fn} once per connection selected by the scope's workspace: those whose
     * workspace filters contain it or the wildcard. {@link BroadcastScope.Kind#ALL} selects
     * every connection. Task subscriptions are not consulted here.
     */
    public void forEachMatching(BroadcastScope scope, BiConsumer<String, ClientChannel> fn) {
        lock.lock();
        try {
            for (Map.Entry<String, Connection> entry : connections.entrySet()) {
                Connection connection = entry.getValue();
                if (scope.kind() == BroadcastScope.Kind.ALL
                        || connection.workspaces.contains(scope.workspaceId())
                        || connection.workspaces.contains(WILDCARD)) {
                    fn.accept(entry.getKey(), connection.channel);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Invokes {@code fn} once per connection subscribed to {@code taskId}, regardless of
     * its workspace filters.
     */
    public void forEachSubscribedToTask(String taskId, BiConsumer<String, ClientChannel> fn) {
        lock.lock();
        try {
            for (Map.Entry<String, Connection> entry : connections.entrySet()) {
                if (entry.getValue().tasks.contains(taskId)) {
                    fn.accept(entry.getKey(), entry.getValue().channel);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    void sendHeartbeats() {
        Map<String, ClientChannel> targets = new LinkedHashMap<>();
        forEachMatching(BroadcastScope.all(), targets::put);
        if (targets.isEmpty()) {
            return;
        }

        log.debug("Sending heartbeat to {} connection(s)", targets.size());
        targets.forEach((clientId, channel) -> {
            try {
                if (!channel.isOpen()) {
                    unregister(clientId);
                    return;
                }
                channel.sendHeartbeat();
            } catch (IOException | RuntimeException e) {
                log.debug("Heartbeat failed for {} (connection likely half-open): {}", clientId, e.getMessage());
                unregister(clientId);
                channel.close();
            }
        });
    }

    /**
     * Immutable copy of one connection's filters.
     */
    public record Filters(Set<String> workspaces, Set<String> tasks) {
        public Filters {
            workspaces = Set.copyOf(workspaces);
            tasks = Set.copyOf(tasks);
        }
    }

    private static final class Connection {
        private final ClientChannel channel;
        private final Set<String> workspaces = new LinkedHashSet<>();
        private final Set<String> tasks = new LinkedHashSet<>();

        private Connection(ClientChannel channel) {
            this.channel = channel;
        }

        private Filters snapshot() {
            return new Filters(workspaces, tasks);
        }
    }
}
