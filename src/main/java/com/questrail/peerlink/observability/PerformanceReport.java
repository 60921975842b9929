package com.questrail.peerlink.observability;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of timings collected by {@link PerformanceRecordingSink},
 * keyed by operation name ({@code "send"}, {@code "receive"}, or the name of a
 * timer started with {@link PerformanceRecordingSink#startTimer(String)}).
 *
 * <p>{@link #toJson()} is the hand-off format for collaborators that ship the
 * report elsewhere; {@link #summary()} is meant for logs.</p>
 */
public record PerformanceReport(Map<String, OperationStats> operations) {

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    public PerformanceReport {
        operations = Map.copyOf(Objects.requireNonNull(operations, "operations"));
    }

    public Optional<OperationStats> operation(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * Operations sorted by name, so exports are stable.
     */
    public List<OperationStats> sorted() {
        return operations.values().stream()
                .sorted(Comparator.comparing(OperationStats::name))
                .collect(Collectors.toList());
    }

    /**
     * Serializes the report as
     * {@code {"operations":[{"name":..,"count":..,"totalNanos":..,"minNanos":..,
     * "maxNanos":..,"meanNanos":..,"totalBytes":..}, ...]}}.
     */
    public String toJson() {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode list = root.putArray("operations");
        for (OperationStats stats : sorted()) {
            list.addObject()
                    .put("name", stats.name())
                    .put("count", stats.count())
                    .put("totalNanos", stats.totalNanos())
                    .put("minNanos", stats.minNanos())
                    .put("maxNanos", stats.maxNanos())
                    .put("meanNanos", stats.mean().toNanos())
                    .put("totalBytes", stats.totalBytes());
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize performance report", e);
        }
    }

    /**
     * One line per operation, e.g. {@code send: n=3 mean=1.2ms min=0.8ms max=2.0ms bytes=96}.
     */
    public String summary() {
        if (operations.isEmpty()) {
            return "no measurements";
        }
        return sorted().stream()
                .map(OperationStats::summary)
                .collect(Collectors.joining(System.lineSeparator()));
    }

    /**
     * Aggregated timings for one operation.
     */
    public record OperationStats(
            String name,
            long count,
            long totalNanos,
            long minNanos,
            long maxNanos,
            long totalBytes
    ) {
        public Duration mean() {
            return count == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / count);
        }

        public Duration min() {
            return Duration.ofNanos(minNanos);
        }

        public Duration max() {
            return Duration.ofNanos(maxNanos);
        }

        String summary() {
            return String.format(Locale.ROOT, "%s: n=%d mean=%.1fms min=%.1fms max=%.1fms bytes=%d",
                    name, count, millis(mean().toNanos()), millis(minNanos), millis(maxNanos), totalBytes);
        }

        OperationStats plus(long elapsedNanos, int bytes) {
            return new OperationStats(
                    name,
                    count + 1,
                    totalNanos + elapsedNanos,
                    Math.min(minNanos, elapsedNanos),
                    Math.max(maxNanos, elapsedNanos),
                    totalBytes + bytes);
        }

        static OperationStats first(String name, long elapsedNanos, int bytes) {
            return new OperationStats(name, 1, elapsedNanos, elapsedNanos, elapsedNanos, bytes);
        }

        private static double millis(long nanos) {
            return nanos / 1_000_000.0;
        }
    }
}
