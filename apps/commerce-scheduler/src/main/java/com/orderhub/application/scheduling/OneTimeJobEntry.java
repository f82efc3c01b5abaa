package com.orderhub.application.scheduling;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 일회성 작업 예약 항목.
 * <p>
 * 상태는 PENDING에서 FIRED 또는 CANCELLED로 한 번만 바뀌며, 이 상태가 취소 토큰 역할을 합니다.
 * </p>
 */
class OneTimeJobEntry {

    enum State {
        PENDING,
        FIRED,
        CANCELLED
    }

    private final String jobId;
    private final Instant executeTime;
    private final Instant createdAt;
    private final long sequence;
    private final Runnable task;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    OneTimeJobEntry(String jobId, Instant executeTime, Instant createdAt, long sequence, Runnable task) {
        this.jobId = jobId;
        this.executeTime = executeTime;
        this.createdAt = createdAt;
        this.sequence = sequence;
        this.task = task;
    }

    String getJobId() {
        return jobId;
    }

    Instant getExecuteTime() {
        return executeTime;
    }

    long getSequence() {
        return sequence;
    }

    Runnable getTask() {
        return task;
    }

    boolean markFired() {
        return state.compareAndSet(State.PENDING, State.FIRED);
    }

    boolean cancel() {
        return state.compareAndSet(State.PENDING, State.CANCELLED);
    }

    boolean isPending() {
        return state.get() == State.PENDING;
    }

    OneTimeJob toView() {
        return new OneTimeJob(jobId, OneTimeJob.TYPE, executeTime, createdAt);
    }
}
