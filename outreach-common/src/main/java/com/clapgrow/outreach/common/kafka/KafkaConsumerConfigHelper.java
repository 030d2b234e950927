package com.clapgrow.outreach.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Consumer settings for long-running command consumers (campaign run requests).
 *
 * <p>A single record can keep the listener thread busy for as long as a campaign run lasts,
 * which is bounded by rate-limit waits rather than by processing cost. The consumer therefore
 * polls one record at a time and gets a generous {@code max.poll.interval.ms}; offsets are
 * committed manually once the run has finished.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * String groupId = KafkaConsumerConfigHelper.buildGroupId("outreach-engine-runs", "prod");
 * Map<String, Object> props = KafkaConsumerConfigHelper.createRunConsumerProperties(
 *     bootstrapServers, groupId, KafkaConsumerConfigHelper.DEFAULT_MAX_POLL_INTERVAL_MS);
 * }</pre>
 */
public final class KafkaConsumerConfigHelper {

    /** Default upper bound for one run between polls. */
    public static final int DEFAULT_MAX_POLL_INTERVAL_MS = 2 * 60 * 60 * 1000;

    private KafkaConsumerConfigHelper() {
    }

    /**
     * @param bootstrapServers  Kafka bootstrap servers (e.g., "localhost:9092")
     * @param groupId           consumer group ID, environment prefix included
     * @param maxPollIntervalMs longest time a single record may take to process
     * @return consumer properties for DefaultKafkaConsumerFactory
     */
    public static Map<String, Object> createRunConsumerProperties(String bootstrapServers, String groupId,
                                                                  int maxPollIntervalMs) {
        if (maxPollIntervalMs <= 0) {
            throw new IllegalArgumentException("maxPollIntervalMs must be positive");
        }
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // Offsets are acknowledged by the listener after the run returns
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);

        // One run per poll; a run may block for a long time
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);
        configProps.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, maxPollIntervalMs);

        configProps.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        configProps.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);
        configProps.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        configProps.put(
            ConsumerConfig.PARTITION_ASSIGNMENT_STRATEGY_CONFIG,
            "org.apache.kafka.clients.consumer.CooperativeStickyAssignor"
        );

        return configProps;
    }

    /**
     * Builds a consumer group ID with optional environment prefix.
     *
     * <ul>
     *   <li>{@code buildGroupId("outreach-engine-runs", "prod")} → "prod-outreach-engine-runs"</li>
     *   <li>{@code buildGroupId("outreach-engine-runs", null)} → "outreach-engine-runs"</li>
     * </ul>
     */
    public static String buildGroupId(String baseGroupId, String environmentPrefix) {
        if (environmentPrefix != null && !environmentPrefix.trim().isEmpty()) {
            return environmentPrefix.trim() + "-" + baseGroupId;
        }
        return baseGroupId;
    }
}
