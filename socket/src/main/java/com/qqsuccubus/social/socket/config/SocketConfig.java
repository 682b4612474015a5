package com.qqsuccubus.social.socket.config;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for the socket node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    String nodeId;
    int httpPort;
    String wsPath;
    String redisUrl;
    int perConnBufferSize;
    int pingInterval;      // seconds of write silence before a ping frame is sent
    int idleTimeout;       // seconds of read silence before the connection is closed
    int maxFramePayload;   // bytes
    int messageMaxLength;  // characters of a direct message text

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .nodeId(getEnv("NODE_ID", "social-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .wsPath(getEnv("WS_PATH", "/ws"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "25")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .maxFramePayload(Integer.parseInt(getEnv("MAX_FRAME_PAYLOAD", "65536")))
                .messageMaxLength(Integer.parseInt(getEnv("MESSAGE_MAX_LENGTH", "5000")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
