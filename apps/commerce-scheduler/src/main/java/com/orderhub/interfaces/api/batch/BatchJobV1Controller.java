package com.orderhub.interfaces.api.batch;

import com.orderhub.application.scheduling.SchedulingManager;
import com.orderhub.interfaces.api.ApiResponse;
import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 배치 작업 관리 API v1 컨트롤러.
 * <p>
 * 운영자가 배치 작업을 수동으로 실행하거나 상태를 조회/취소할 때 사용합니다.
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/admin/batch-jobs")
public class BatchJobV1Controller {

    private final SchedulingManager schedulingManager;

    /**
     * 배치 작업을 비동기로 실행합니다.
     * <p>
     * 작업 유형 검증만 동기로 수행하고, 실행 결과는 {@code GET /{jobId}}로 조회합니다.
     * </p>
     *
     * @param request 작업 유형과 파라미터
     * @return 접수 결과
     */
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<BatchJobV1Dto.TriggerResponse> trigger(@RequestBody BatchJobV1Dto.TriggerRequest request) {
        if (request.jobType() == null || request.jobType().isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "배치 작업 유형은 필수입니다.");
        }
        schedulingManager.triggerBatchJob(request.jobType(), request.toParameters());
        return ApiResponse.success(new BatchJobV1Dto.TriggerResponse(request.jobType(), true));
    }

    @GetMapping("/{jobId}")
    public ApiResponse<BatchJobV1Dto.JobResponse> getJob(@PathVariable String jobId) {
        return schedulingManager.getJobStatus(jobId)
            .map(BatchJobV1Dto.JobResponse::from)
            .map(ApiResponse::success)
            .orElseThrow(() -> new CoreException(ErrorType.NOT_FOUND,
                String.format("배치 작업을 찾을 수 없습니다. (작업 ID: %s)", jobId)));
    }

    @GetMapping("/running")
    public ApiResponse<BatchJobV1Dto.JobsResponse> getRunningJobs() {
        return ApiResponse.success(BatchJobV1Dto.JobsResponse.from(schedulingManager.getRunningJobs()));
    }

    @GetMapping("/one-time")
    public ApiResponse<BatchJobV1Dto.OneTimeJobsResponse> getOneTimeJobs() {
        return ApiResponse.success(BatchJobV1Dto.OneTimeJobsResponse.from(schedulingManager.getOneTimeJobs()));
    }

    @GetMapping("/recurring")
    public ApiResponse<BatchJobV1Dto.RecurringTasksResponse> getRecurringTasks() {
        return ApiResponse.success(BatchJobV1Dto.RecurringTasksResponse.from(schedulingManager.getScheduledTasks()));
    }

    /**
     * 작업을 취소합니다. 실행 중인 배치, 일회성 작업, 반복 작업 순으로 찾습니다.
     */
    @DeleteMapping("/{jobId}")
    public ApiResponse<BatchJobV1Dto.CancelResponse> cancel(@PathVariable String jobId) {
        if (!schedulingManager.cancelJob(jobId)) {
            throw new CoreException(ErrorType.NOT_FOUND,
                String.format("취소할 작업을 찾을 수 없습니다. (작업 ID: %s)", jobId));
        }
        return ApiResponse.success(new BatchJobV1Dto.CancelResponse(jobId, true));
    }
}
