package com.qqsuccubus.pubsub.redis.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for reliable delivery over Redis, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ReliableDeliveryConfig {

    String redisUrl;
    Duration messageTtl;       // how long published messages stay recoverable
    Duration checkInterval;    // delivery monitor tick
    Duration idleThreshold;    // quiet time before the monitor polls for missed messages
    int loadBatchSize;         // ids read per recovery script call

    public static ReliableDeliveryConfig fromEnv() {
        return ReliableDeliveryConfig.builder()
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .messageTtl(Duration.ofSeconds(Long.parseLong(getEnv("MESSAGE_TTL_SEC", "600"))))
            .checkInterval(Duration.ofSeconds(Long.parseLong(getEnv("CHECK_INTERVAL_SEC", "30"))))
            .idleThreshold(Duration.ofSeconds(Long.parseLong(getEnv("IDLE_THRESHOLD_SEC", "30"))))
            .loadBatchSize(Integer.parseInt(getEnv("LOAD_BATCH_SIZE", "500")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
