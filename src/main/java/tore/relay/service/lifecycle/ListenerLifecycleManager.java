package tore.relay.service.lifecycle;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import tore.relay.config.RelayProperties;
import tore.relay.dto.CanonicalEvent;
import tore.relay.exception.ChainConnectionException;
import tore.relay.exception.EnqueueException;
import tore.relay.exception.RelayConfigurationException;
import tore.relay.service.backfill.BackfillRange;
import tore.relay.service.backfill.BackfillResult;
import tore.relay.service.backfill.BackfillScanner;
import tore.relay.service.chain.ChainConnectionFactory;
import tore.relay.service.chain.ChainLogClient;
import tore.relay.service.chain.ContractBinding;
import tore.relay.service.checkpoint.CheckpointStore;
import tore.relay.service.event.EventNormalizer;
import tore.relay.service.queue.RelayJobQueue;
import tore.relay.service.subscription.LiveEventSubscriber;
import tore.relay.service.worker.RelayWorkerPool;

/**
 * Wires the checkpoint store, backfill scanner, live subscriber and queue into one listener and
 * owns its lifetime.
 *
 * <p>Startup order: open the connection, attach the queue, start the live subscriber in buffering
 * mode, read the checkpoint and the chain height, backfill the gap, advance the checkpoint (never
 * backwards, even when the node lags behind it), then release the subscriber. Live events that arrive while the backfill runs are held back and the
 * ones the backfill already covered are dropped.
 *
 * <p>A backfill with failed range queries or rejected events still advances the checkpoint and goes
 * live; the leftovers are retried on their own by {@link #retryUnfinishedBackfill()} until they
 * succeed, so a range the node keeps refusing never blocks the listener.
 *
 * <p>A lost subscription schedules {@link #resynchronize()}, which rebuilds the listener and
 * backfills from the checkpoint.
 */
@Service
@Slf4j
public class ListenerLifecycleManager {

    private final RelayProperties properties;
    private final ChainConnectionFactory connectionFactory;
    private final EventNormalizer normalizer;
    private final RelayJobQueue queue;
    private final CheckpointStore checkpointStore;
    private final RelayWorkerPool workerPool;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "relay-resync");
        t.setDaemon(true);
        return t;
    });

    private volatile ListenerResourceBundle bundle;
    private volatile List<ContractBinding> bindings;
    private volatile ScheduledFuture<?> pendingResync;
    private volatile ScheduledFuture<?> pendingBackfillRetry;
    private volatile BackfillResult unfinishedBackfill;
    private volatile boolean shuttingDown;

    public ListenerLifecycleManager(
        RelayProperties properties,
        ChainConnectionFactory connectionFactory,
        EventNormalizer normalizer,
        RelayJobQueue queue,
        CheckpointStore checkpointStore,
        RelayWorkerPool workerPool
    ) {
        this.properties = properties;
        this.connectionFactory = connectionFactory;
        this.normalizer = normalizer;
        this.queue = queue;
        this.checkpointStore = checkpointStore;
        this.workerPool = workerPool;
    }

    /**
     * Validates the configuration, starts the listener and the worker pool. Configuration errors
     * propagate and stop the application; chain errors only delay the listener.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.isEnabled()) {
            log.info("Contract event relay is disabled");
            return;
        }
        validateConfiguration();

        queue.ensureSchema();
        workerPool.start(queue, properties.getWorker().getConcurrency());

        try {
            initialize();
        } catch (RelayConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Listener initialization failed: {} - retrying in {}", e.getMessage(), reconnectDelay());
            scheduleResync();
        }
    }

    /**
     * Checks every required setting and parses the event signatures.
     *
     * @throws RelayConfigurationException on the first missing or invalid setting
     */
    public List<ContractBinding> validateConfiguration() {
        if (isBlank(properties.getNode().getUrl())) {
            throw new RelayConfigurationException("relay.node.url", "relay.node.url is required");
        }
        if (isBlank(properties.getDownstream().getBaseUrl())) {
            throw new RelayConfigurationException("relay.downstream.base-url", "relay.downstream.base-url is required");
        }
        if (properties.getWorker().getConcurrency() < 1) {
            throw new RelayConfigurationException("relay.worker.concurrency", "relay.worker.concurrency must be >= 1");
        }
        if (properties.getQueue().getMaxAttempts() < 1) {
            throw new RelayConfigurationException("relay.queue.max-attempts", "relay.queue.max-attempts must be >= 1");
        }
        Duration backoff = properties.getQueue().getBackoffDelay();
        if (backoff == null || backoff.isNegative() || backoff.isZero()) {
            throw new RelayConfigurationException("relay.queue.backoff-delay", "relay.queue.backoff-delay must be positive");
        }
        List<ContractBinding> parsed = ContractBinding.fromProperties(properties);
        this.bindings = parsed;
        log.info("Relaying {} event type(s) from {} contract(s)",
            parsed.stream().mapToInt(b -> b.events().size()).sum(), parsed.size());
        return parsed;
    }

    /**
     * Builds the listener, or returns the existing one unchanged.
     */
    public synchronized ListenerResourceBundle initialize() {
        if (bundle != null) {
            return bundle;
        }
        List<ContractBinding> contracts = bindings != null ? bindings : validateConfiguration();

        ChainLogClient connection = connectionFactory.open(properties.getNode().getUrl());
        LiveEventSubscriber subscriber = new LiveEventSubscriber(connection, contracts, normalizer, queue);
        try {
            queue.ensureSchema();

            subscriber.setConnectionLostListener(this::onConnectionLost);
            subscriber.subscribeBuffered(checkpointStore::advance);

            long checkpoint = checkpointStore.read();
            long currentHeight = connection.currentBlockNumber();
            long syncedTo = Math.max(checkpoint, currentHeight);
            long fromBlock = Math.max(checkpoint + 1, properties.getBackfill().getStartBlock());
            log.info("Checkpoint at block {}, chain head at block {}", checkpoint, currentHeight);
            if (currentHeight < checkpoint) {
                log.warn("Node reports head {} behind checkpoint {}; keeping the checkpoint", currentHeight, checkpoint);
            }

            BackfillResult backfill;
            if (checkpoint < currentHeight) {
                backfill = newScanner(connection, contracts).scan(fromBlock, currentHeight);
            } else {
                backfill = BackfillResult.skipped(fromBlock, currentHeight);
                log.info("No backfill needed");
            }
            if (!backfill.isComplete()) {
                log.warn("Backfill of blocks {}-{} left {} range(s) and {} event(s) behind; retrying them every {}",
                    fromBlock, currentHeight, backfill.failedQueries(), backfill.failedEnqueues(), backfillRetryDelay());
                keepUnfinished(backfill);
            }
            checkpointStore.advance(currentHeight);

            if (!subscriber.release(syncedTo)) {
                log.warn("Live events were dropped while backfilling; listener stays buffered until it resynchronizes");
            }

            ListenerResourceBundle created = new ListenerResourceBundle(
                connection, contracts, queue, subscriber, backfill, syncedTo, this::cleanup);
            bundle = created;
            log.info("Contract event listener ready at block {}", syncedTo);
            if (unfinishedBackfill != null) {
                scheduleBackfillRetry();
            }
            return created;
        } catch (RuntimeException e) {
            subscriber.unsubscribe();
            connection.shutdown();
            throw e;
        }
    }

    /**
     * Stops the live subscriptions, closes the connection and forgets the listener.
     */
    public synchronized void cleanup() {
        ListenerResourceBundle current = bundle;
        if (current == null) {
            return;
        }
        bundle = null;
        current.subscriber().unsubscribe();
        current.connection().shutdown();
        log.info("Contract event listener cleaned up");
    }

    /**
     * Rebuilds the listener after a connection loss; reschedules itself while the node stays down.
     */
    public synchronized void resynchronize() {
        pendingResync = null;
        if (shuttingDown) {
            return;
        }
        log.info("Resynchronizing contract event listener from checkpoint {}", checkpointStore.read());
        cleanup();
        try {
            initialize();
        } catch (ChainConnectionException | EnqueueException e) {
            log.warn("Resynchronization failed: {} - retrying in {}", e.getMessage(), reconnectDelay());
            scheduleResync();
        } catch (RelayConfigurationException e) {
            log.error("Resynchronization stopped: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected resynchronization failure - retrying in {}", reconnectDelay(), e);
            scheduleResync();
        }
    }

    /**
     * Repeats the failed range queries and rejected events of earlier backfills over the live
     * connection; reschedules itself until nothing is left. Without a listener it waits for the
     * next {@link #initialize()} to schedule it again.
     */
    public synchronized void retryUnfinishedBackfill() {
        pendingBackfillRetry = null;
        BackfillResult unfinished = unfinishedBackfill;
        ListenerResourceBundle current = bundle;
        if (shuttingDown || unfinished == null || current == null) {
            return;
        }
        try {
            BackfillResult result = newScanner(current.connection(), current.contractBindings()).retry(unfinished);
            if (result.isComplete()) {
                unfinishedBackfill = null;
                log.info("Unfinished backfill of blocks {}-{} recovered ({} events enqueued)",
                    result.fromBlock(), result.toBlock(), result.enqueued());
                return;
            }
            unfinishedBackfill = result;
        } catch (RuntimeException e) {
            log.error("Backfill retry failed: {}", e.getMessage(), e);
        }
        scheduleBackfillRetry();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        scheduler.shutdownNow();
        workerPool.stop();
        cleanup();
    }

    public boolean isInitialized() {
        return bundle != null;
    }

    public boolean hasUnfinishedBackfill() {
        return unfinishedBackfill != null;
    }

    public boolean isResyncPending() {
        ScheduledFuture<?> future = pendingResync;
        return future != null && !future.isDone();
    }

    public Map<String, Object> describe() {
        Map<String, Object> state = new LinkedHashMap<>();
        ListenerResourceBundle current = bundle;
        state.put("enabled", properties.isEnabled());
        state.put("listening", current != null);
        state.put("buffering", current != null && current.subscriber().isBuffering());
        state.put("subscriptions", current != null ? current.subscriber().getActiveSubscriptionCount() : 0);
        state.put("resync_pending", isResyncPending());
        state.put("synced_to_block", current != null ? current.syncedToBlock() : null);
        BackfillResult unfinished = unfinishedBackfill;
        state.put("backfill_ranges_pending", unfinished != null ? unfinished.failedQueries() : 0);
        state.put("backfill_events_pending", unfinished != null ? unfinished.failedEnqueues() : 0);
        state.put("workers_running", workerPool.isRunning());
        state.put("deliveries_in_flight", workerPool.getInFlightCount());
        return state;
    }

    private void onConnectionLost() {
        log.warn("Chain subscription lost; resynchronizing in {}", reconnectDelay());
        scheduleResync();
    }

    private synchronized void scheduleResync() {
        if (shuttingDown || isResyncPending()) {
            return;
        }
        pendingResync = scheduler.schedule(this::resynchronize, reconnectDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void scheduleBackfillRetry() {
        ScheduledFuture<?> future = pendingBackfillRetry;
        if (shuttingDown || (future != null && !future.isDone())) {
            return;
        }
        pendingBackfillRetry = scheduler.schedule(
            this::retryUnfinishedBackfill, backfillRetryDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void keepUnfinished(BackfillResult result) {
        BackfillResult previous = unfinishedBackfill;
        if (previous == null) {
            unfinishedBackfill = result;
            return;
        }
        List<BackfillRange> ranges = new ArrayList<>(previous.failedRanges());
        ranges.addAll(result.failedRanges());
        List<CanonicalEvent> events = new ArrayList<>(previous.unqueuedEvents());
        events.addAll(result.unqueuedEvents());
        unfinishedBackfill = new BackfillResult(
            Math.min(previous.fromBlock(), result.fromBlock()),
            Math.max(previous.toBlock(), result.toBlock()),
            0, 0, 0, ranges, events);
    }

    private BackfillScanner newScanner(ChainLogClient connection, List<ContractBinding> contracts) {
        return new BackfillScanner(connection, contracts, normalizer, queue, properties.getBackfill().getMaxBlockRange());
    }

    private Duration backfillRetryDelay() {
        Duration delay = properties.getBackfill().getRetryDelay();
        return delay == null || delay.isNegative() || delay.isZero() ? Duration.ofSeconds(30) : delay;
    }

    private Duration reconnectDelay() {
        Duration delay = properties.getNode().getReconnectDelay();
        return delay == null || delay.isNegative() ? Duration.ofSeconds(30) : delay;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
