package tore.relay.service.backfill;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.core.methods.response.Log;
import tore.relay.dto.CanonicalEvent;
import tore.relay.exception.ChainConnectionException;
import tore.relay.exception.EnqueueException;
import tore.relay.exception.EventParseException;
import tore.relay.service.chain.ChainLogClient;
import tore.relay.service.chain.ContractBinding;
import tore.relay.service.event.EventDescriptor;
import tore.relay.service.event.EventNormalizer;
import tore.relay.service.queue.RelayJobQueue;
import tore.relay.util.LogSanitizer;

/**
 * Recovers events emitted while the relay was offline.
 *
 * <p>Every configured event of every bound contract is queried over the range, the results are
 * merged and sorted by {@code (blockNumber, logIndex)}, and enqueued one after the other so the
 * queue sees them in chain order. Failures are isolated: a failed query skips that event type for
 * the chunk, a failed enqueue skips that one event. Both are kept in the {@link BackfillResult} so
 * {@link #retry(BackfillResult)} can pick them up later.
 */
@Slf4j
public class BackfillScanner {

    static final Comparator<CanonicalEvent> CHAIN_ORDER = Comparator
        .comparingLong(CanonicalEvent::blockNumber)
        .thenComparingLong(CanonicalEvent::logIndex);

    private final ChainLogClient chainClient;
    private final List<ContractBinding> bindings;
    private final EventNormalizer normalizer;
    private final RelayJobQueue queue;
    private final int maxBlockRange;

    public BackfillScanner(
        ChainLogClient chainClient,
        List<ContractBinding> bindings,
        EventNormalizer normalizer,
        RelayJobQueue queue,
        int maxBlockRange
    ) {
        this.chainClient = chainClient;
        this.bindings = List.copyOf(bindings);
        this.normalizer = normalizer;
        this.queue = queue;
        this.maxBlockRange = Math.max(1, maxBlockRange);
    }

    /**
     * Scans the inclusive range {@code [fromBlock, toBlock]}. Does nothing when {@code fromBlock > toBlock}.
     */
    public BackfillResult scan(long fromBlock, long toBlock) {
        if (fromBlock > toBlock) {
            return BackfillResult.skipped(fromBlock, toBlock);
        }
        log.info("Backfill started for blocks {}-{}", fromBlock, toBlock);

        List<BackfillRange> ranges = new ArrayList<>();
        for (ContractBinding binding : bindings) {
            for (EventDescriptor descriptor : binding.events()) {
                for (long chunkStart = fromBlock; chunkStart <= toBlock; chunkStart += maxBlockRange) {
                    long chunkEnd = Math.min(toBlock, chunkStart + maxBlockRange - 1L);
                    ranges.add(new BackfillRange(binding, descriptor, chunkStart, chunkEnd));
                }
            }
        }
        return run(fromBlock, toBlock, ranges, List.of());
    }

    /**
     * Repeats only what an earlier pass left behind: its failed range queries and the events the
     * queue rejected. Ranges that succeeded before are not queried again.
     */
    public BackfillResult retry(BackfillResult previous) {
        if (previous.isComplete()) {
            return previous;
        }
        log.info("Retrying backfill of blocks {}-{}: {} range(s), {} unqueued event(s)",
            previous.fromBlock(), previous.toBlock(), previous.failedQueries(), previous.failedEnqueues());
        return run(previous.fromBlock(), previous.toBlock(), previous.failedRanges(), previous.unqueuedEvents());
    }

    private BackfillResult run(long fromBlock, long toBlock, List<BackfillRange> ranges, List<CanonicalEvent> pending) {
        List<CanonicalEvent> collected = new ArrayList<>(pending);
        List<BackfillRange> failedRanges = new ArrayList<>();
        int skippedLogs = 0;

        for (BackfillRange range : ranges) {
            ContractBinding binding = range.binding();
            EventDescriptor descriptor = range.event();
            List<Log> logs;
            try {
                logs = chainClient.getLogs(binding.address(), descriptor.topic(), range.fromBlock(), range.toBlock());
            } catch (ChainConnectionException e) {
                failedRanges.add(range);
                log.error("Backfill query failed for {}: {}", range, e.getMessage());
                continue;
            }
            for (Log eventLog : logs) {
                if (eventLog.isRemoved()) {
                    skippedLogs++;
                    log.debug("Skipping removed log in tx {}", LogSanitizer.shortHash(eventLog.getTransactionHash()));
                    continue;
                }
                try {
                    collected.add(normalizer.normalize(descriptor, eventLog, binding.name()));
                } catch (EventParseException e) {
                    skippedLogs++;
                    log.warn("Skipping undecodable {} log in tx {}: {}",
                        descriptor.name(), LogSanitizer.shortHash(e.getTransactionHash()), e.getMessage());
                }
            }
        }

        collected.sort(CHAIN_ORDER);

        int enqueued = 0;
        List<CanonicalEvent> unqueued = new ArrayList<>();
        for (CanonicalEvent event : collected) {
            try {
                queue.enqueue(event.eventName(), event);
                enqueued++;
            } catch (EnqueueException | IllegalArgumentException e) {
                unqueued.add(event);
                log.error("Backfill enqueue failed for {}.{} (block={}, logIndex={}): {}",
                    event.sourceContract(), event.eventName(), event.blockNumber(), event.logIndex(), e.getMessage());
            }
        }

        BackfillResult result = new BackfillResult(
            fromBlock, toBlock, collected.size(), enqueued, skippedLogs, failedRanges, unqueued);
        if (result.isComplete()) {
            log.info("Backfill completed for blocks {}-{}: {} events enqueued", fromBlock, toBlock, enqueued);
        } else {
            log.warn("Backfill finished with errors for blocks {}-{}: {} enqueued, failed ranges {}, {} failed enqueues",
                fromBlock, toBlock, enqueued, failedRanges, unqueued.size());
        }
        return result;
    }
}
