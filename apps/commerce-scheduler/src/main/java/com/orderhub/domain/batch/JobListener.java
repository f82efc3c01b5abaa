package com.orderhub.domain.batch;

/**
 * 배치 작업 생명주기 콜백.
 * <p>
 * 콜백에서 발생한 예외는 작업 결과에 영향을 주지 않고 로그로만 기록됩니다.
 * </p>
 */
public interface JobListener {

    JobListener NONE = new JobListener() {
    };

    /** 배치 하나의 집계가 반영된 직후 호출됩니다. */
    default void onProgress(JobSnapshot snapshot) {
    }

    default void onComplete(JobSnapshot snapshot) {
    }

    default void onError(JobSnapshot snapshot, Throwable error) {
    }
}
