package io.controlplane.provisioning;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stand-in for real provisioning work: completes after a random delay in
 * {@code [0, maxDelay]}. The caller blocks at most until its deadline.
 */
@Slf4j
public class SimulatedProvisioner {

    private final Duration maxDelay;
    private final ScheduledExecutorService timers;
    private final Set<CompletableFuture<Void>> pending = ConcurrentHashMap.newKeySet();

    public SimulatedProvisioner(Duration maxDelay) {
        this.maxDelay = maxDelay;
        AtomicInteger threadCount = new AtomicInteger();
        this.timers = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "provisioning-timer-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Run the work for {@code resourceId} and wait for it.
     *
     * @throws ProvisioningCancelledException if {@code deadline} elapses first or the calling
     *                                        thread is interrupted; the pending work is cancelled
     */
    public void provision(String resourceId, Duration deadline) throws ProvisioningCancelledException {
        long delayMillis = maxDelay.toMillis() <= 0 ? 0 : ThreadLocalRandom.current().nextLong(maxDelay.toMillis() + 1);
        log.debug("Provisioning work for {} will take {}ms (deadline {}ms)", resourceId, delayMillis, deadline.toMillis());

        CompletableFuture<Void> work = new CompletableFuture<>();
        pending.add(work);
        try {
            timers.schedule(() -> work.complete(null), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            pending.remove(work);
            throw new ProvisioningCancelledException(resourceId, "provisioner is shutting down", e);
        }

        try {
            work.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            work.cancel(true);
            throw new ProvisioningCancelledException(resourceId, "deadline of " + deadline.toMillis() + "ms exceeded", e);
        } catch (InterruptedException e) {
            work.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProvisioningCancelledException(resourceId, "interrupted while waiting", e);
        } catch (CancellationException e) {
            throw new ProvisioningCancelledException(resourceId, "work cancelled", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Simulated provisioning failed for " + resourceId, e.getCause());
        } finally {
            pending.remove(work);
        }
    }

    /**
     * Stop the timers and cancel every in-flight wait; waiting callers get a
     * {@link ProvisioningCancelledException}.
     */
    public void shutdown() {
        log.info("Stopping provisioning timers, cancelling {} in-flight waits", pending.size());
        timers.shutdownNow();
        for (CompletableFuture<Void> work : pending) {
            work.cancel(true);
        }
    }
}
