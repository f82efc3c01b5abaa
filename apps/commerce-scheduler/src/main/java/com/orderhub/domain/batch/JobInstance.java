package com.orderhub.domain.batch;

import java.time.Duration;
import java.time.Instant;

/**
 * 실행 중인 배치 작업의 상태를 관리합니다.
 * <p>
 * 여러 배치 스레드가 동시에 집계를 갱신하므로 모든 상태 변경은 인스턴스 단위로 동기화됩니다.
 * </p>
 * <p>
 * <b>상태 전이 규칙:</b>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED, CANCELLED)로의 전이는 RUNNING에서만 가능하며 한 번만 일어납니다.</li>
 *   <li>종료 후에는 배치 집계가 반영되지 않습니다.</li>
 *   <li>진행률은 실행 중 최대 99이며 COMPLETED 전이 시에만 100이 됩니다.</li>
 * </ul>
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
public class JobInstance {

    private static final int MAX_RUNNING_PROGRESS = 99;

    private final String jobId;
    private final String jobType;
    private final Instant startTime;

    private JobStatus status = JobStatus.RUNNING;
    private long totalItems;
    private long processedItems;
    private long failedItems;
    private int progress;
    private Instant endTime;
    private Long durationMillis;
    private String error;

    private JobInstance(String jobId, String jobType, Instant startTime) {
        this.jobId = jobId;
        this.jobType = jobType;
        this.startTime = startTime;
    }

    public static JobInstance start(String jobId, String jobType, Instant now) {
        return new JobInstance(jobId, jobType, now);
    }

    public String getJobId() {
        return jobId;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    public synchronized void initializeTotal(long totalItems) {
        if (status == JobStatus.RUNNING) {
            this.totalItems = totalItems;
        }
    }

    /**
     * 한 배치의 처리 결과를 누적합니다.
     *
     * @param succeeded 성공 아이템 수
     * @param failed 실패 아이템 수
     * @return 반영 여부 (작업이 이미 종료되었으면 false)
     */
    public synchronized boolean recordBatch(long succeeded, long failed) {
        if (status != JobStatus.RUNNING) {
            return false;
        }
        processedItems += succeeded;
        failedItems += failed;
        if (totalItems > 0) {
            int calculated = (int) Math.round((processedItems + failedItems) * 100.0 / totalItems);
            progress = Math.max(progress, Math.min(MAX_RUNNING_PROGRESS, calculated));
        }
        return true;
    }

    public synchronized boolean complete(Instant now) {
        if (!finish(JobStatus.COMPLETED, now)) {
            return false;
        }
        progress = 100;
        return true;
    }

    public synchronized boolean fail(String error, Instant now) {
        if (!finish(JobStatus.FAILED, now)) {
            return false;
        }
        this.error = error;
        return true;
    }

    public synchronized boolean cancel(Instant now) {
        return finish(JobStatus.CANCELLED, now);
    }

    public synchronized JobSnapshot snapshot(Instant updatedAt) {
        return new JobSnapshot(
            jobId,
            jobType,
            status,
            totalItems,
            processedItems,
            failedItems,
            progress,
            startTime,
            endTime,
            durationMillis,
            error,
            updatedAt
        );
    }

    private boolean finish(JobStatus target, Instant now) {
        if (status != JobStatus.RUNNING) {
            return false;
        }
        status = target;
        endTime = now;
        durationMillis = Duration.between(startTime, now).toMillis();
        return true;
    }
}
