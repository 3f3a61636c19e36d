package io.controlplane.models;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory desired/observed counters of this node.
 * <p>
 * {@code desired} is written by administrative calls; {@code observed} has a single writer,
 * the global reconciler running on the current leader. Both are advisory: the ledger store
 * stays authoritative.
 */
public class ClusterState {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long desired;
    private long observed;

    public ClusterState(long desired, long observed) {
        this.desired = desired;
        this.observed = observed;
    }

    public long getDesired() {
        lock.readLock().lock();
        try {
            return desired;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getObserved() {
        lock.readLock().lock();
        try {
            return observed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setDesired(long desired) {
        lock.writeLock().lock();
        try {
            this.desired = desired;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long incrementDesired() {
        lock.writeLock().lock();
        try {
            return ++desired;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Only the global reconciler calls this.
     */
    public void setObserved(long observed) {
        lock.writeLock().lock();
        try {
            this.observed = observed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Consistent view of both counters taken under one read lock.
     */
    public Snapshot snapshot() {
        lock.readLock().lock();
        try {
            return new Snapshot(desired, observed);
        } finally {
            lock.readLock().unlock();
        }
    }

    public static final class Snapshot {
        private final long desired;
        private final long observed;

        Snapshot(long desired, long observed) {
            this.desired = desired;
            this.observed = observed;
        }

        public long getDesired() {
            return desired;
        }

        public long getObserved() {
            return observed;
        }

        public boolean isStable() {
            return desired == observed;
        }
    }
}
