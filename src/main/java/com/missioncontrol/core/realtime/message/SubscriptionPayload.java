package com.missioncontrol.core.realtime.message;

import java.util.List;

/**
 * Topic filters: inbound on {@code subscribe}/{@code unsubscribe}, outbound on the
 * {@code subscribed} ack where it lists the connection's filters after the change.
 */
public record SubscriptionPayload(List<String> workspaces, List<String> tasks) implements EventPayload {

    public SubscriptionPayload {
        workspaces = workspaces != null ? List.copyOf(workspaces) : List.of();
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }
}
