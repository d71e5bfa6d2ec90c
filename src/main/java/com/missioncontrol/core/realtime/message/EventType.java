package com.missioncontrol.core.realtime.message;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed set of envelope types exchanged over the realtime transports, each bound to the
 * payload record it carries.
 */
public enum EventType {
    // Client -> Server
    SUBSCRIBE("subscribe", SubscriptionPayload.class),
    UNSUBSCRIBE("unsubscribe", SubscriptionPayload.class),

    // Server -> Client, subscription transport
    CONNECTED("connected", ConnectedPayload.class),
    SUBSCRIBED("subscribed", SubscriptionPayload.class),
    TASK_UPDATE("task_update", TaskUpdatePayload.class),
    PLAN_UPDATE("plan_update", PlanUpdatePayload.class),
    APPROVAL_REQUEST("approval_request", ApprovalRequestPayload.class),
    PROGRESS_UPDATE("progress_update", ProgressUpdatePayload.class),
    ERROR("error", ErrorPayload.class),

    // Server -> Client, push stream
    PING("ping", PingPayload.class),
    PLAN_CREATED("plan_created", PlanPayload.class),
    PLAN_APPROVED("plan_approved", PlanPayload.class),
    PLAN_REJECTED("plan_rejected", PlanPayload.class),
    TASK_UPDATED("task_updated", TaskPayload.class);

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    EventType(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public static Optional<EventType> fromWire(String wireName) {
        for (EventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
