package io.controlplane.stats;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A message to the {@link StatsAggregator}: something happened {@code count} times.
 */
@Getter
@ToString
@AllArgsConstructor
public class StatsEvent {

    public enum Type {
        PROVISION_CREATED,
        PROVISION_ALREADY_PROVISIONED,
        PROVISION_IN_PROGRESS,
        PROVISION_CANCELLED,
        PROVISION_ERROR,
        IDEMPOTENT_REPLAY,
        LEADER_TICK,
        FOLLOWER_TICK,
        RESOURCES_CREATED,
        RESOURCES_DELETED,
        RESOURCES_COMPLETED
    }

    private final Type type;
    private final long count;

    public static StatsEvent of(Type type) {
        return new StatsEvent(type, 1);
    }
}
