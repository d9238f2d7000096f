package tore.relay.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tore.relay.service.checkpoint.CheckpointStore;
import tore.relay.service.lifecycle.ListenerLifecycleManager;
import tore.relay.service.queue.QueueCounts;
import tore.relay.service.queue.QueueJob;
import tore.relay.service.queue.RelayJobQueue;

/**
 * Inspection endpoints for operators: listener state, queue counts and the failed set.
 */
@RestController
@RequestMapping("/relay")
@RequiredArgsConstructor
@Slf4j
public class RelayStatusController {

    static final int MAX_FAILED_LIMIT = 500;

    private final ListenerLifecycleManager lifecycleManager;
    private final RelayJobQueue queue;
    private final CheckpointStore checkpointStore;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("timestamp", Instant.now().toString());
        status.put("checkpoint", checkpointStore.read());
        status.put("listener", lifecycleManager.describe());

        QueueCounts counts = queue.counts();
        Map<String, Object> queueStatus = new LinkedHashMap<>();
        queueStatus.put("waiting", counts.waiting());
        queueStatus.put("active", counts.active());
        queueStatus.put("completed", counts.completed());
        queueStatus.put("failed", counts.failed());
        queueStatus.put("max_attempts", queue.getMaxAttempts());
        status.put("queue", queueStatus);

        return ResponseEntity.ok(status);
    }

    @GetMapping("/jobs/failed")
    public ResponseEntity<Map<String, Object>> failedJobs(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_FAILED_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_FAILED_LIMIT);
        }
        List<Map<String, Object>> jobs = queue.failedJobs(limit).stream()
            .map(RelayStatusController::toView)
            .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("count", jobs.size());
        response.put("jobs", jobs);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/jobs/failed/{id}/retry")
    public ResponseEntity<Map<String, Object>> retryFailedJob(@PathVariable long id) {
        Map<String, Object> response = new LinkedHashMap<>();
        if (!queue.retryFailed(id)) {
            response.put("success", false);
            response.put("message", "No failed job with id " + id);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        log.info("Failed relay job {} moved back to waiting", id);
        response.put("success", true);
        response.put("id", id);
        response.put("status", "WAITING");
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> toView(QueueJob job) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", job.id());
        view.put("name", job.name());
        view.put("attempts", job.attemptCount());
        view.put("last_error", job.lastError());
        view.put("created_at", job.createdAt() != null ? job.createdAt().toString() : null);
        if (job.payload() != null) {
            view.put("block_number", job.payload().blockNumber());
            view.put("transaction_hash", job.payload().transactionHash());
            view.put("log_index", job.payload().logIndex());
            view.put("source_contract", job.payload().sourceContract());
        }
        return view;
    }
}
