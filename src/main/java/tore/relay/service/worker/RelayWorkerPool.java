package tore.relay.service.worker;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import tore.relay.exception.EnqueueException;
import tore.relay.exception.RelayDeliveryException;
import tore.relay.service.queue.JobStatus;
import tore.relay.service.queue.QueueJob;
import tore.relay.service.queue.RelayJobQueue;

/**
 * Bounded pool of workers draining the relay queue into the downstream service.
 *
 * <p>Each worker claims one job at a time, so at most {@code concurrency} deliveries run at once.
 * Delivery order across workers is not guaranteed. {@link #stop()} stops claiming; deliveries that
 * are already running finish on their own.
 */
@Slf4j
public class RelayWorkerPool {

    private final DownstreamRelayClient relayClient;
    private final Duration pollInterval;
    private final Duration stallTimeout;

    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean running;
    private volatile RelayJobQueue queue;
    private ExecutorService workers;
    private ScheduledExecutorService maintenance;

    public RelayWorkerPool(DownstreamRelayClient relayClient, Duration pollInterval, Duration stallTimeout) {
        this.relayClient = relayClient;
        this.pollInterval = pollInterval;
        this.stallTimeout = stallTimeout;
    }

    public synchronized void start(RelayJobQueue queue, int concurrency) {
        if (running) {
            log.warn("Relay worker pool already running");
            return;
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }
        this.queue = queue;
        this.running = true;

        AtomicInteger threadIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "relay-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < concurrency; i++) {
            workers.submit(this::workLoop);
        }

        maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-queue-maintenance");
            t.setDaemon(true);
            return t;
        });
        long stallMs = Math.max(1000L, stallTimeout.toMillis());
        maintenance.scheduleWithFixedDelay(this::recoverStalledJobs, 0, stallMs, TimeUnit.MILLISECONDS);

        log.info("Relay worker pool started (concurrency={}, downstream={})", concurrency, relayClient.getBaseUrl());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        workers.shutdown();
        maintenance.shutdownNow();
        log.info("Relay worker pool stopping ({} deliveries in flight will finish)", inFlight.get());
    }

    public boolean isRunning() {
        return running;
    }

    public int getInFlightCount() {
        return inFlight.get();
    }

    /**
     * Claims and processes a single job.
     *
     * @return false when no job was due
     */
    public boolean processNext(RelayJobQueue jobQueue) {
        Optional<QueueJob> claimed = jobQueue.claimNext();
        if (claimed.isEmpty()) {
            return false;
        }
        process(jobQueue, claimed.get());
        return true;
    }

    private void workLoop() {
        while (running) {
            boolean worked;
            try {
                worked = processNext(queue);
            } catch (EnqueueException e) {
                log.warn("Relay queue unavailable: {}", e.getMessage());
                worked = false;
            } catch (RuntimeException e) {
                log.error("Unexpected relay worker error", e);
                worked = false;
            }
            if (!worked && !sleep(pollInterval)) {
                return;
            }
        }
    }

    private void process(RelayJobQueue jobQueue, QueueJob job) {
        inFlight.incrementAndGet();
        try {
            if (job.payload() == null) {
                recordFailure(jobQueue, job, "Payload cannot be read");
                return;
            }
            relayClient.relay(job.name(), job.payload());
            jobQueue.complete(job);
            log.info("Relay job {} completed ({} block={} logIndex={}, attempt {})",
                job.id(), job.name(), job.payload().blockNumber(), job.payload().logIndex(), job.attemptCount());
        } catch (RelayDeliveryException e) {
            recordFailure(jobQueue, job, e.getMessage());
        } catch (EnqueueException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error relaying job {}", job.id(), e);
            recordFailure(jobQueue, job, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void recordFailure(RelayJobQueue jobQueue, QueueJob job, String error) {
        JobStatus next = jobQueue.fail(job, error);
        if (next == JobStatus.FAILED) {
            log.warn("Relay job {} ({}) moved to the failed set after {} attempts: {}",
                job.id(), job.name(), job.attemptCount(), error);
        } else {
            log.warn("Relay job {} ({}) attempt {}/{} failed: {}",
                job.id(), job.name(), job.attemptCount(), job.maxAttempts(), error);
        }
    }

    private void recoverStalledJobs() {
        try {
            queue.recoverStalled(stallTimeout);
        } catch (RuntimeException e) {
            log.warn("Stalled job recovery failed: {}", e.getMessage());
        }
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(Math.max(10L, duration.toMillis()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
