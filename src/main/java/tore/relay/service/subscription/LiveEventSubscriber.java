package tore.relay.service.subscription;

import io.reactivex.disposables.Disposable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongConsumer;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.core.methods.response.Log;
import tore.relay.dto.CanonicalEvent;
import tore.relay.exception.EnqueueException;
import tore.relay.exception.EventParseException;
import tore.relay.service.chain.ChainLogClient;
import tore.relay.service.chain.ContractBinding;
import tore.relay.service.event.EventDescriptor;
import tore.relay.service.event.EventNormalizer;
import tore.relay.service.queue.RelayJobQueue;
import tore.relay.util.LogSanitizer;

/**
 * Subscribes to new logs of every configured event and feeds them into the relay queue.
 *
 * <p>Subscription callbacks only normalize and publish onto an internal channel; a single consumer
 * thread takes events from the channel in arrival order, enqueues them and reports the block to
 * the {@code onProcessed} callback. Logs flagged as removed by a reorganization never reach the
 * channel.
 *
 * <p>When started buffered, events are held back until {@link #release(long)} is called with the
 * height the backfill covered; buffered events at or below that height are dropped. The buffer is
 * bounded: once it overflows, release keeps the subscriber buffering and reports the connection as
 * lost so the listener is rebuilt and the next backfill covers what was dropped.
 */
@Slf4j
public class LiveEventSubscriber {

    static final int CHANNEL_CAPACITY = 10_000;
    private static final long POLL_TIMEOUT_MS = 500;

    private final int bufferCapacity;
    private final ChainLogClient chainClient;
    private final List<ContractBinding> bindings;
    private final EventNormalizer normalizer;
    private final RelayJobQueue queue;

    private final BlockingQueue<CanonicalEvent> channel = new LinkedBlockingQueue<>(CHANNEL_CAPACITY);
    private final Object bufferLock = new Object();
    private final List<CanonicalEvent> buffer = new ArrayList<>();
    private int bufferOverflow;
    private final Map<String, Disposable> subscriptions = new ConcurrentHashMap<>();
    private final AtomicBoolean connectionLostReported = new AtomicBoolean(false);

    private volatile boolean buffering;
    private volatile boolean running;
    private volatile Thread consumer;
    private volatile LongConsumer onProcessed;
    private volatile Runnable connectionLostListener = () -> { };

    public LiveEventSubscriber(
        ChainLogClient chainClient,
        List<ContractBinding> bindings,
        EventNormalizer normalizer,
        RelayJobQueue queue
    ) {
        this(chainClient, bindings, normalizer, queue, CHANNEL_CAPACITY);
    }

    LiveEventSubscriber(
        ChainLogClient chainClient,
        List<ContractBinding> bindings,
        EventNormalizer normalizer,
        RelayJobQueue queue,
        int bufferCapacity
    ) {
        this.bufferCapacity = Math.max(1, bufferCapacity);
        this.chainClient = chainClient;
        this.bindings = List.copyOf(bindings);
        this.normalizer = normalizer;
        this.queue = queue;
    }

    /**
     * Registers one subscription per configured event and starts delivering immediately.
     */
    public void subscribe(LongConsumer onProcessed) {
        start(onProcessed, false);
    }

    /**
     * Registers the subscriptions but holds events back until {@link #release(long)}.
     */
    public void subscribeBuffered(LongConsumer onProcessed) {
        start(onProcessed, true);
    }

    /**
     * Stops buffering. Buffered events with {@code blockNumber <= coveredHeight} are dropped because
     * the backfill already enqueued them; the rest are delivered in arrival order.
     *
     * @return false when the buffer overflowed; nothing is delivered and a resync is requested
     */
    public boolean release(long coveredHeight) {
        boolean overflowed;
        synchronized (bufferLock) {
            if (!buffering) {
                return true;
            }
            overflowed = bufferOverflow > 0;
            if (overflowed) {
                log.warn("Live buffer overflowed while backfilling ({} events dropped); requesting a resync from block {}",
                    bufferOverflow, coveredHeight);
                buffer.clear();
                bufferOverflow = 0;
            }
        }
        if (overflowed) {
            reportConnectionLost();
            return false;
        }
        synchronized (bufferLock) {
            if (!buffering) {
                return true;
            }
            int dropped = 0;
            for (CanonicalEvent event : buffer) {
                if (event.blockNumber() <= coveredHeight) {
                    dropped++;
                    continue;
                }
                publish(event);
            }
            log.info("Live subscriber released at block {} ({} buffered events forwarded, {} already backfilled)",
                coveredHeight, buffer.size() - dropped, dropped);
            buffer.clear();
            buffering = false;
        }
        return true;
    }

    /**
     * Called at most once per subscription round when any stream errors out or completes.
     */
    public void setConnectionLostListener(Runnable listener) {
        this.connectionLostListener = listener != null ? listener : () -> { };
    }

    /**
     * Disposes every subscription and stops the consumer thread. Events still in the channel are
     * not enqueued; the checkpoint was not advanced for them, so the next backfill picks them up.
     */
    public synchronized void unsubscribe() {
        if (!running) {
            return;
        }
        running = false;
        subscriptions.forEach((key, disposable) -> {
            if (disposable != null && !disposable.isDisposed()) {
                disposable.dispose();
            }
        });
        subscriptions.clear();
        Thread current = consumer;
        if (current != null) {
            try {
                current.join(POLL_TIMEOUT_MS * 4);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        consumer = null;
        synchronized (bufferLock) {
            buffer.clear();
            bufferOverflow = 0;
        }
        int pending = channel.size();
        channel.clear();
        log.info("Live subscriber stopped ({} undelivered events left for the next backfill)", pending);
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isBuffering() {
        return buffering;
    }

    public int getActiveSubscriptionCount() {
        return (int) subscriptions.values().stream().filter(d -> !d.isDisposed()).count();
    }

    private synchronized void start(LongConsumer onProcessed, boolean buffered) {
        if (running) {
            log.warn("Live subscriber already running");
            return;
        }
        this.onProcessed = onProcessed != null ? onProcessed : block -> { };
        this.buffering = buffered;
        this.running = true;
        connectionLostReported.set(false);

        Thread thread = new Thread(this::consumeLoop, "live-event-consumer");
        thread.setDaemon(true);
        consumer = thread;
        thread.start();

        for (ContractBinding binding : bindings) {
            for (EventDescriptor descriptor : binding.events()) {
                subscribeTo(binding, descriptor);
            }
        }
        log.info("Live subscriber registered {} subscription(s){}",
            subscriptions.size(), buffered ? " (buffering until backfill completes)" : "");
    }

    private void subscribeTo(ContractBinding binding, EventDescriptor descriptor) {
        String key = binding.address() + ":" + descriptor.topic();
        try {
            Disposable subscription = chainClient.logFlowable(binding.address(), descriptor.topic()).subscribe(
                eventLog -> handleLog(binding, descriptor, eventLog),
                error -> {
                    log.warn("Subscription error for {}.{}: {}", binding.name(), descriptor.name(), error.getMessage());
                    reportConnectionLost();
                },
                () -> {
                    log.info("Subscription completed for {}.{}", binding.name(), descriptor.name());
                    reportConnectionLost();
                }
            );
            subscriptions.put(key, subscription);
            log.debug("Subscribed to {}.{} ({})", binding.name(), descriptor.name(), descriptor.topic());
        } catch (RuntimeException e) {
            log.error("Failed to subscribe to {}.{}: {}", binding.name(), descriptor.name(), e.getMessage());
            reportConnectionLost();
        }
    }

    /**
     * Runs on the subscription thread; never throws so the stream stays alive.
     */
    void handleLog(ContractBinding binding, EventDescriptor descriptor, Log eventLog) {
        try {
            if (eventLog == null) {
                return;
            }
            if (eventLog.isRemoved()) {
                log.info("Discarding {} log retracted by reorg (tx {})",
                    descriptor.name(), LogSanitizer.shortHash(eventLog.getTransactionHash()));
                return;
            }
            CanonicalEvent event = normalizer.normalize(descriptor, eventLog, binding.name());
            synchronized (bufferLock) {
                if (buffering) {
                    if (buffer.size() < bufferCapacity) {
                        buffer.add(event);
                    } else if (bufferOverflow++ == 0) {
                        log.warn("Live buffer full at {} events; dropping until the next resync", bufferCapacity);
                    }
                    return;
                }
            }
            publish(event);
        } catch (EventParseException e) {
            log.warn("Skipping undecodable {} log (tx {}): {}",
                descriptor.name(), LogSanitizer.shortHash(e.getTransactionHash()), e.getMessage());
        } catch (Exception e) {
            log.error("Error handling live {} event: {}", descriptor.name(), e.getMessage(), e);
        }
    }

    private void publish(CanonicalEvent event) {
        try {
            channel.put(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing {} event at block {}", event.eventName(), event.blockNumber());
        }
    }

    private void consumeLoop() {
        while (running) {
            CanonicalEvent event;
            try {
                event = channel.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null || !running) {
                continue;
            }
            deliver(event);
        }
    }

    void deliver(CanonicalEvent event) {
        try {
            queue.enqueue(event.eventName(), event);
        } catch (EnqueueException | IllegalArgumentException e) {
            log.error("Live enqueue failed for {}.{} (block={}, logIndex={}): {} - checkpoint not advanced",
                event.sourceContract(), event.eventName(), event.blockNumber(), event.logIndex(), e.getMessage());
            return;
        }
        log.info("Live event queued: {}.{} (block={}, tx={})",
            event.sourceContract(), event.eventName(), event.blockNumber(), LogSanitizer.shortHash(event.transactionHash()));
        try {
            onProcessed.accept(event.blockNumber());
        } catch (RuntimeException e) {
            log.warn("Checkpoint update failed after block {}: {}", event.blockNumber(), e.getMessage());
        }
    }

    private void reportConnectionLost() {
        if (running && connectionLostReported.compareAndSet(false, true)) {
            try {
                connectionLostListener.run();
            } catch (RuntimeException e) {
                log.error("Connection-lost handler failed: {}", e.getMessage(), e);
            }
        }
    }
}
