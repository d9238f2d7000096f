package tore.relay.service.backfill;

import java.util.List;
import tore.relay.dto.CanonicalEvent;

/**
 * Outcome of one backfill pass.
 *
 * @param found          canonical events collected across all queries
 * @param enqueued       events accepted by the queue
 * @param skippedLogs    logs dropped because they were removed or could not be decoded
 * @param failedRanges   range queries that failed; nothing from them was enqueued
 * @param unqueuedEvents events the queue rejected, in chain order
 */
public record BackfillResult(
    long fromBlock,
    long toBlock,
    int found,
    int enqueued,
    int skippedLogs,
    List<BackfillRange> failedRanges,
    List<CanonicalEvent> unqueuedEvents
) {

    public BackfillResult {
        failedRanges = List.copyOf(failedRanges);
        unqueuedEvents = List.copyOf(unqueuedEvents);
    }

    public static BackfillResult skipped(long fromBlock, long toBlock) {
        return new BackfillResult(fromBlock, toBlock, 0, 0, 0, List.of(), List.of());
    }

    public int failedQueries() {
        return failedRanges.size();
    }

    public int failedEnqueues() {
        return unqueuedEvents.size();
    }

    public boolean isComplete() {
        return failedRanges.isEmpty() && unqueuedEvents.isEmpty();
    }
}
