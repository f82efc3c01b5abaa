package com.orderhub.application.scheduling;

import com.orderhub.domain.batch.BatchJobParameters;
import com.orderhub.domain.batch.JobSnapshot;

/**
 * 배치 작업 유형 하나를 실행하는 핸들러.
 */
@FunctionalInterface
public interface BatchJobHandler {

    JobSnapshot handle(BatchJobParameters parameters);
}
