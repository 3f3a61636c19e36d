package io.controlplane.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of the aggregated counters.
 */
@Getter
@AllArgsConstructor
public class StatsSnapshot {

    @JsonProperty("node_id")
    private final String nodeId;

    @JsonProperty("since")
    private final Instant since;

    @JsonProperty("counters")
    private final Map<String, Long> counters;

    public long get(StatsEvent.Type type) {
        return counters.getOrDefault(type.name().toLowerCase(), 0L);
    }
}
