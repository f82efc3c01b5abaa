package com.orderhub.interfaces.api.batch;

import com.orderhub.application.scheduling.OneTimeJob;
import com.orderhub.application.scheduling.RecurringTaskInfo;
import com.orderhub.domain.batch.BatchJobParameters;
import com.orderhub.domain.batch.JobSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 배치 작업 관리 API v1의 요청/응답 DTO.
 */
public class BatchJobV1Dto {

    /**
     * 배치 작업 실행 요청.
     *
     * @param jobType 배치 작업 유형 (예: LOYALTY_FESTIVAL_BONUS)
     * @param parameters 작업 파라미터 (선택)
     */
    public record TriggerRequest(String jobType, Map<String, Object> parameters) {
        public BatchJobParameters toParameters() {
            return BatchJobParameters.of(parameters);
        }
    }

    public record TriggerResponse(String jobType, boolean accepted) {
    }

    public record JobResponse(
        String jobId,
        String jobType,
        String status,
        long totalItems,
        long processedItems,
        long failedItems,
        int progress,
        Instant startTime,
        Instant endTime,
        Long durationMillis,
        String error
    ) {
        public static JobResponse from(JobSnapshot snapshot) {
            return new JobResponse(
                snapshot.jobId(),
                snapshot.jobType(),
                snapshot.status().name(),
                snapshot.totalItems(),
                snapshot.processedItems(),
                snapshot.failedItems(),
                snapshot.progress(),
                snapshot.startTime(),
                snapshot.endTime(),
                snapshot.durationMillis(),
                snapshot.error()
            );
        }
    }

    public record JobsResponse(List<JobResponse> jobs) {
        public static JobsResponse from(List<JobSnapshot> snapshots) {
            return new JobsResponse(snapshots.stream().map(JobResponse::from).toList());
        }
    }

    public record OneTimeJobResponse(String jobId, String type, Instant executeTime, Instant createdAt) {
        public static OneTimeJobResponse from(OneTimeJob job) {
            return new OneTimeJobResponse(job.jobId(), job.type(), job.executeTime(), job.createdAt());
        }
    }

    public record OneTimeJobsResponse(List<OneTimeJobResponse> jobs) {
        public static OneTimeJobsResponse from(List<OneTimeJob> jobs) {
            return new OneTimeJobsResponse(jobs.stream().map(OneTimeJobResponse::from).toList());
        }
    }

    public record RecurringTaskResponse(
        String taskId,
        String cronExpression,
        String timezone,
        boolean executing,
        Instant createdAt,
        String lastExecutionStatus,
        Instant lastExecutedAt,
        Long lastDurationMillis,
        String lastErrorMessage
    ) {
        public static RecurringTaskResponse from(RecurringTaskInfo info) {
            RecurringTaskInfo.TaskExecution last = info.lastExecution();
            return new RecurringTaskResponse(
                info.taskId(),
                info.cronExpression(),
                info.timezone().getId(),
                info.executing(),
                info.createdAt(),
                last != null ? last.status() : null,
                last != null ? last.executedAt() : null,
                last != null ? last.durationMillis() : null,
                last != null ? last.errorMessage() : null
            );
        }
    }

    public record RecurringTasksResponse(List<RecurringTaskResponse> tasks) {
        public static RecurringTasksResponse from(List<RecurringTaskInfo> tasks) {
            return new RecurringTasksResponse(tasks.stream().map(RecurringTaskResponse::from).toList());
        }
    }

    public record CancelResponse(String jobId, boolean cancelled) {
    }
}
