package com.orderhub.domain.batch;

/**
 * 배치 작업 상태.
 */
public enum JobStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
