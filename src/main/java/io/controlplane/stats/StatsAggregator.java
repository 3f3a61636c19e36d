package io.controlplane.stats;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Owns the process-wide provisioning and reconciliation tallies.
 * <p>
 * The counters live on a single aggregator thread and are reached only through messages on
 * its queue: request threads and the reconciliation loop post {@link StatsEvent}s, readers
 * post a query and receive an immutable {@link StatsSnapshot}.
 */
@Slf4j
public class StatsAggregator {

    private final String nodeId;
    private final Clock clock;
    private final BlockingQueue<Object> mailbox = new LinkedBlockingQueue<>();
    private final Thread worker;
    private volatile boolean running;

    // Touched only by the worker thread
    private final Map<StatsEvent.Type, Long> counters = new EnumMap<>(StatsEvent.Type.class);
    private Instant since;

    private static final Object POISON_PILL = new Object();

    public StatsAggregator(String nodeId, Clock clock) {
        this.nodeId = nodeId;
        this.clock = clock;
        this.worker = new Thread(this::runLoop, "stats-aggregator");
        this.worker.setDaemon(true);
    }

    public void start() {
        since = Instant.now(clock);
        running = true;
        worker.start();
        log.info("Stats aggregator started for node: {}", nodeId);
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        mailbox.offer(POISON_PILL);
        try {
            worker.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stats aggregator stopped for node: {}", nodeId);
    }

    /**
     * Post an event. Never blocks the caller.
     */
    public void record(StatsEvent event) {
        if (running) {
            mailbox.offer(event);
        }
    }

    public void record(StatsEvent.Type type, long count) {
        if (count > 0) {
            record(new StatsEvent(type, count));
        }
    }

    /**
     * Ask the aggregator for a snapshot; completes once every event posted before this call
     * has been applied.
     */
    public CompletableFuture<StatsSnapshot> snapshot() {
        SnapshotQuery query = new SnapshotQuery();
        if (!running) {
            query.reply.completeExceptionally(new IllegalStateException("Stats aggregator is not running"));
            return query.reply;
        }
        mailbox.offer(query);
        return query.reply;
    }

    private void runLoop() {
        while (true) {
            Object message;
            try {
                message = mailbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            if (message == POISON_PILL) {
                drainPendingQueries();
                return;
            } else if (message instanceof StatsEvent) {
                StatsEvent event = (StatsEvent) message;
                counters.merge(event.getType(), event.getCount(), Long::sum);
            } else if (message instanceof SnapshotQuery) {
                ((SnapshotQuery) message).reply.complete(buildSnapshot());
            }
        }
    }

    private void drainPendingQueries() {
        Object message;
        while ((message = mailbox.poll()) != null) {
            if (message instanceof SnapshotQuery) {
                ((SnapshotQuery) message).reply.complete(buildSnapshot());
            }
        }
    }

    private StatsSnapshot buildSnapshot() {
        Map<String, Long> copy = new LinkedHashMap<>();
        for (StatsEvent.Type type : StatsEvent.Type.values()) {
            copy.put(type.name().toLowerCase(), counters.getOrDefault(type, 0L));
        }
        return new StatsSnapshot(nodeId, since, Map.copyOf(copy));
    }

    private static final class SnapshotQuery {
        private final CompletableFuture<StatsSnapshot> reply = new CompletableFuture<>();
    }
}
