package com.kmg.receipts.api;

import com.kmg.receipts.dto.EnqueueResponse;
import com.kmg.receipts.dto.QueueStatisticsView;
import com.kmg.receipts.dto.UsageStatsView;
import com.kmg.receipts.model.JobOperation;
import com.kmg.receipts.model.JobPriority;
import com.kmg.receipts.model.NewJob;
import com.kmg.receipts.service.QueueService;
import com.kmg.receipts.service.UsageService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = QueueController.class)
class QueueControllerTest {
    private static final String ENQUEUE_BODY = """
            {"sourceType": "receipt", "sourceId": "r-01.jpg", "operation": "EXTRACT_RECEIPT", "priority": "HIGH"}
            """;

    @Autowired
    MockMvc mvc;

    @MockBean
    QueueService queueService;

    @MockBean
    UsageService usageService;

    @Test
    void newJobIsCreated() throws Exception {
        when(queueService.enqueue(any(NewJob.class))).thenReturn(new EnqueueResponse("job-1", true));

        mvc.perform(post("/api/queue/jobs").contentType(MediaType.APPLICATION_JSON).content(ENQUEUE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.created").value(true));

        ArgumentCaptor<NewJob> captor = ArgumentCaptor.forClass(NewJob.class);
        verify(queueService).enqueue(captor.capture());
        assertThat(captor.getValue().operation()).isEqualTo(JobOperation.EXTRACT_RECEIPT);
        assertThat(captor.getValue().priority()).isEqualTo(JobPriority.HIGH);
        assertThat(captor.getValue().batchId()).isNull();
    }

    @Test
    void duplicateEnqueueReturnsTheActiveJob() throws Exception {
        when(queueService.enqueue(any(NewJob.class))).thenReturn(new EnqueueResponse("job-1", false));

        mvc.perform(post("/api/queue/jobs").contentType(MediaType.APPLICATION_JSON).content(ENQUEUE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.created").value(false));
    }

    @Test
    void enqueueRequiresOperation() throws Exception {
        mvc.perform(post("/api/queue/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceType\": \"receipt\", \"sourceId\": \"r-01.jpg\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(queueService);
    }

    @Test
    void statisticsAreExposed() throws Exception {
        when(queueService.getQueueStatistics()).thenReturn(new QueueStatisticsView(
                Map.of("PENDING", 4, "COMPLETED", 10),
                Map.of("HIGH", 1, "MEDIUM", 3),
                "2025-03-01T09:00Z",
                2,
                1250.5
        ));

        mvc.perform(get("/api/queue/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobsByStatus.PENDING").value(4))
                .andExpect(jsonPath("$.pendingByPriority.HIGH").value(1))
                .andExpect(jsonPath("$.activeWorkers").value(2))
                .andExpect(jsonPath("$.averageProcessingTimeMs").value(1250.5));
    }

    @Test
    void usageIsExposed() throws Exception {
        when(usageService.usage()).thenReturn(new UsageStatsView(
                List.of(new UsageStatsView.ProviderWindow("gemini", "2025-03-01T09:00Z", 60_000, 12, 15, 9_000, 1_000_000, null)),
                List.of(new UsageStatsView.ProviderTotals("gemini", 40, 37, 3, 52_000))
        ));

        mvc.perform(get("/api/queue/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.windows[0].requestsUsed").value(12))
                .andExpect(jsonPath("$.totals[0].successes").value(37));
    }

    @Test
    void requeueFailedUsesTheRequestedLimit() throws Exception {
        when(queueService.requeueFailed(25)).thenReturn(3);

        mvc.perform(post("/api/queue/requeue-failed").param("maxItems", "25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requeued").value(3));
    }

    @Test
    void requeueFailedRejectsNonPositiveLimit() throws Exception {
        mvc.perform(post("/api/queue/requeue-failed").param("maxItems", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("maxItems must be positive."));
        verifyNoInteractions(queueService);
    }
}
