package tore.relay.controller;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tore.relay.exception.EnqueueException;
import tore.relay.exception.GlobalExceptionHandler;
import tore.relay.service.checkpoint.CheckpointStore;
import tore.relay.service.lifecycle.ListenerLifecycleManager;
import tore.relay.service.queue.JobStatus;
import tore.relay.service.queue.QueueCounts;
import tore.relay.service.queue.QueueJob;
import tore.relay.service.queue.RelayJobQueue;
import tore.relay.support.QueueFixtures;

@ExtendWith(MockitoExtension.class)
class RelayStatusControllerTest {

    @Mock
    private ListenerLifecycleManager lifecycleManager;

    @Mock
    private RelayJobQueue queue;

    @Mock
    private CheckpointStore checkpointStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RelayStatusController controller = new RelayStatusController(lifecycleManager, queue, checkpointStore);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Nested
    @DisplayName("Status endpoint")
    class StatusEndpoint {

        @Test
        @DisplayName("Should report checkpoint, listener state and queue counts")
        void shouldReportStatus() throws Exception {
            Map<String, Object> listener = new LinkedHashMap<>();
            listener.put("listening", true);
            listener.put("synced_to_block", 1200L);
            when(checkpointStore.read()).thenReturn(1234L);
            when(lifecycleManager.describe()).thenReturn(listener);
            when(queue.counts()).thenReturn(new QueueCounts(3, 1, 40, 2));
            when(queue.getMaxAttempts()).thenReturn(5);

            mockMvc.perform(get("/relay/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkpoint").value(1234))
                .andExpect(jsonPath("$.listener.listening").value(true))
                .andExpect(jsonPath("$.queue.waiting").value(3))
                .andExpect(jsonPath("$.queue.failed").value(2))
                .andExpect(jsonPath("$.queue.max_attempts").value(5));
        }

        @Test
        @DisplayName("Should answer 503 when the queue storage is down")
        void shouldReturn503WhenQueueIsDown() throws Exception {
            when(checkpointStore.read()).thenReturn(0L);
            when(lifecycleManager.describe()).thenReturn(Map.of());
            when(queue.counts()).thenThrow(new EnqueueException("Cannot count jobs: connection refused"));

            mockMvc.perform(get("/relay/status"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false));
        }
    }

    @Nested
    @DisplayName("Failed jobs endpoints")
    class FailedJobsEndpoints {

        @Test
        @DisplayName("Should list failed jobs with their last error")
        void shouldListFailedJobs() throws Exception {
            QueueJob job = new QueueJob(7, "NftLocked", QueueFixtures.event("NftLocked", 100, 2), 5, 5,
                JobStatus.FAILED, Instant.parse("2026-01-15T10:00:00Z"), "Downstream responded with 500",
                Instant.parse("2026-01-15T09:00:00Z"));
            when(queue.failedJobs(10)).thenReturn(List.of(job));

            mockMvc.perform(get("/relay/jobs/failed").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.jobs[0].id").value(7))
                .andExpect(jsonPath("$.jobs[0].name").value("NftLocked"))
                .andExpect(jsonPath("$.jobs[0].last_error").value("Downstream responded with 500"))
                .andExpect(jsonPath("$.jobs[0].block_number").value(100))
                .andExpect(jsonPath("$.jobs[0].log_index").value(2));
        }

        @Test
        @DisplayName("Should reject out-of-range limits")
        void shouldRejectBadLimit() throws Exception {
            mockMvc.perform(get("/relay/jobs/failed").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

            verify(queue, never()).failedJobs(0);
        }

        @Test
        @DisplayName("Should move a failed job back to waiting")
        void shouldRetryFailedJob() throws Exception {
            when(queue.retryFailed(7L)).thenReturn(true);

            mockMvc.perform(post("/relay/jobs/failed/7/retry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("WAITING"));
        }

        @Test
        @DisplayName("Should answer 404 for unknown jobs")
        void shouldReturn404ForUnknownJob() throws Exception {
            when(queue.retryFailed(99L)).thenReturn(false);

            mockMvc.perform(post("/relay/jobs/failed/99/retry"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
        }
    }
}
