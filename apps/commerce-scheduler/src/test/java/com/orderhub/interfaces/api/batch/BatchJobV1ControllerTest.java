package com.orderhub.interfaces.api.batch;

import com.orderhub.application.scheduling.SchedulingManager;
import com.orderhub.domain.batch.BatchJobParameters;
import com.orderhub.domain.batch.JobSnapshot;
import com.orderhub.domain.batch.JobStatus;
import com.orderhub.interfaces.api.ApiControllerAdvice;
import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * BatchJobV1Controller 테스트.
 */
@ExtendWith(MockitoExtension.class)
class BatchJobV1ControllerTest {

    private static final String ENDPOINT = "/api/v1/admin/batch-jobs";

    @Mock
    private SchedulingManager schedulingManager;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BatchJobV1Controller(schedulingManager))
            .setControllerAdvice(new ApiControllerAdvice())
            .build();
    }

    @DisplayName("배치 작업 실행 요청을 접수하면 202 응답을 반환한다.")
    @Test
    void acceptsTrigger() throws Exception {
        // arrange
        when(schedulingManager.triggerBatchJob(eq("LOYALTY_FESTIVAL_BONUS"), any(BatchJobParameters.class)))
            .thenReturn(new CompletableFuture<>());

        // act & assert
        mockMvc.perform(post(ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobType\":\"LOYALTY_FESTIVAL_BONUS\",\"parameters\":{\"multiplier\":2.0}}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.meta.result").value("SUCCESS"))
            .andExpect(jsonPath("$.data.jobType").value("LOYALTY_FESTIVAL_BONUS"))
            .andExpect(jsonPath("$.data.accepted").value(true));
    }

    @DisplayName("알 수 없는 유형이면 400 응답을 반환한다.")
    @Test
    void rejectsUnknownType() throws Exception {
        // arrange
        when(schedulingManager.triggerBatchJob(eq("BOGUS"), any(BatchJobParameters.class)))
            .thenThrow(new CoreException(ErrorType.BAD_REQUEST, "지원하지 않는 배치 작업 유형입니다. (유형: BOGUS)"));

        // act & assert
        mockMvc.perform(post(ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobType\":\"BOGUS\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.meta.result").value("FAIL"))
            .andExpect(jsonPath("$.meta.errorCode").value("Bad Request"));
    }

    @DisplayName("작업 상태를 조회할 수 있다.")
    @Test
    void returnsJobStatus() throws Exception {
        // arrange
        Instant now = Instant.parse("2024-12-15T03:00:00Z");
        when(schedulingManager.getJobStatus("job-1")).thenReturn(Optional.of(
            new JobSnapshot("job-1", "EVENT_STATUS_SYNC", JobStatus.RUNNING, 10, 4, 1, 50, now, null, null, null, now)));

        // act & assert
        mockMvc.perform(get(ENDPOINT + "/job-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("RUNNING"))
            .andExpect(jsonPath("$.data.progress").value(50))
            .andExpect(jsonPath("$.data.failedItems").value(1));
    }

    @DisplayName("없는 작업을 조회하면 404 응답을 반환한다.")
    @Test
    void returnsNotFound_whenJobMissing() throws Exception {
        // arrange
        when(schedulingManager.getJobStatus("missing")).thenReturn(Optional.empty());

        // act & assert
        mockMvc.perform(get(ENDPOINT + "/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.meta.errorCode").value("Not Found"));
    }

    @DisplayName("작업을 취소할 수 있다.")
    @Test
    void cancelsJob() throws Exception {
        // arrange
        when(schedulingManager.cancelJob("daily-notification-digest")).thenReturn(true);

        // act & assert
        mockMvc.perform(delete(ENDPOINT + "/daily-notification-digest"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.cancelled").value(true));
        verify(schedulingManager).cancelJob("daily-notification-digest");
    }

    @DisplayName("취소할 작업이 없으면 404 응답을 반환한다.")
    @Test
    void returnsNotFound_whenNothingToCancel() throws Exception {
        // arrange
        when(schedulingManager.cancelJob("missing")).thenReturn(false);

        // act & assert
        mockMvc.perform(delete(ENDPOINT + "/missing"))
            .andExpect(status().isNotFound());
    }
}
