package com.missioncontrol.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the socket and push-stream transports ({@code mission-control.realtime.*}).
 */
@Component
@ConfigurationProperties(prefix = "mission-control.realtime")
public class RealtimeProperties {

    /** Keepalive interval for both transports. Intermediaries commonly drop idle connections after ~60s. */
    private long heartbeatIntervalSeconds = 30;

    /** Workspace every new socket connection starts subscribed to. */
    private String defaultWorkspace = "default";

    /** How long a single socket send may block before the connection is torn down. */
    private int sendTimeLimitMs = 5_000;

    /** Byte bound on frames buffered inside the session decorator; exceeding it terminates the connection. */
    private int sendBufferLimitBytes = 512 * 1024;

    /** Frames a connection may have waiting behind its in-flight write; one more drops the connection. */
    private int sendQueueLimitFrames = 256;

    /** Push-stream emitter timeout; 0 keeps streams open until the client goes away. */
    private long streamTimeoutMs = 0;

    private String socketPath = "/ws";

    private String[] allowedOrigins = {"*"};

    public long getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
    public void setHeartbeatIntervalSeconds(long heartbeatIntervalSeconds) { this.heartbeatIntervalSeconds = heartbeatIntervalSeconds; }

    public String getDefaultWorkspace() { return defaultWorkspace; }
    public void setDefaultWorkspace(String defaultWorkspace) { this.defaultWorkspace = defaultWorkspace; }

    public int getSendTimeLimitMs() { return sendTimeLimitMs; }
    public void setSendTimeLimitMs(int sendTimeLimitMs) { this.sendTimeLimitMs = sendTimeLimitMs; }

    public int getSendBufferLimitBytes() { return sendBufferLimitBytes; }
    public void setSendBufferLimitBytes(int sendBufferLimitBytes) { this.sendBufferLimitBytes = sendBufferLimitBytes; }

    public int getSendQueueLimitFrames() { return sendQueueLimitFrames; }
    public void setSendQueueLimitFrames(int sendQueueLimitFrames) { this.sendQueueLimitFrames = sendQueueLimitFrames; }

    public long getStreamTimeoutMs() { return streamTimeoutMs; }
    public void setStreamTimeoutMs(long streamTimeoutMs) { this.streamTimeoutMs = streamTimeoutMs; }

    public String getSocketPath() { return socketPath; }
    public void setSocketPath(String socketPath) { this.socketPath = socketPath; }

    public String[] getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(String[] allowedOrigins) { this.allowedOrigins = allowedOrigins; }
}
