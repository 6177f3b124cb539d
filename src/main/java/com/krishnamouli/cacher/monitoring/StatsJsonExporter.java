package com.krishnamouli.cacher.monitoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.krishnamouli.cacher.core.CacheStats;

import java.time.Duration;

/**
 * Renders cache statistics and metrics as JSON for monitoring endpoints
 * and log shippers. Keys and values are written with {@link String#valueOf},
 * so cached payloads never need to be serializable.
 */
public class StatsJsonExporter {

    private final ObjectMapper mapper;

    public StatsJsonExporter() {
        this(new ObjectMapper());
    }

    public StatsJsonExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toNode(CacheStats<?, ?> stats) {
        ObjectNode root = mapper.createObjectNode();
        root.put("evictionPolicy", stats.getPolicyName());
        root.put("capacity", stats.getCapacityLabel());
        root.put("clearingIntervalMs", toMillis(stats.clearingInterval));
        root.put("items", stats.size);
        root.put("occupancy", stats.getOccupancy());
        root.put("hits", stats.hits);
        root.put("misses", stats.misses);
        root.put("hitRate", stats.getHitRate());
        root.put("evictions", stats.evictions);
        root.put("expirations", stats.expirations);

        ArrayNode listing = root.putArray("entries");
        for (CacheStats.EntrySnapshot<?, ?> entry : stats.entries) {
            ObjectNode node = listing.addObject();
            node.put("key", String.valueOf(entry.key));
            node.put("value", String.valueOf(entry.value));
            node.put("ttlMs", toMillis(entry.ttl));
            node.put("counter", entry.counter);
            node.put("lastUsed", entry.lastAccessTime.toString());
        }
        return root;
    }

    public ObjectNode toNode(MetricsCollector.MetricsSnapshot snapshot) {
        ObjectNode root = mapper.createObjectNode();
        root.put("hits", snapshot.hits);
        root.put("misses", snapshot.misses);
        root.put("hitRate", snapshot.hitRate);
        root.put("evictions", snapshot.evictions);
        root.put("expirations", snapshot.expirations);
        root.put("size", snapshot.size);
        root.put("p50LatencyMs", snapshot.p50LatencyMs);
        root.put("p95LatencyMs", snapshot.p95LatencyMs);
        root.put("p99LatencyMs", snapshot.p99LatencyMs);
        root.put("totalOperations", snapshot.totalOperations);
        return root;
    }

    public String toJson(CacheStats<?, ?> stats) throws JsonProcessingException {
        return mapper.writeValueAsString(toNode(stats));
    }

    public String toJson(MetricsCollector.MetricsSnapshot snapshot) throws JsonProcessingException {
        return mapper.writeValueAsString(toNode(snapshot));
    }

    // Saturates at Long.MAX_VALUE where Duration.toMillis would overflow
    static long toMillis(Duration duration) {
        if (duration.getSeconds() >= Long.MAX_VALUE / 1000) {
            return Long.MAX_VALUE;
        }
        return duration.toMillis();
    }
}
