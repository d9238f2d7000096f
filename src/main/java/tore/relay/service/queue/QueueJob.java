package tore.relay.service.queue;

import java.time.Instant;
import tore.relay.dto.CanonicalEvent;

/**
 * Snapshot of a row in the relay job table.
 *
 * @param attemptCount attempts started so far, including the current one for ACTIVE jobs
 * @param availableAt  earliest time a worker may claim the job
 * @param lastError    message of the most recent failed attempt
 */
public record QueueJob(
    long id,
    String name,
    CanonicalEvent payload,
    int attemptCount,
    int maxAttempts,
    JobStatus status,
    Instant availableAt,
    String lastError,
    Instant createdAt
) {

    public boolean hasAttemptsLeft() {
        return attemptCount < maxAttempts;
    }
}
