package com.orderhub.domain.batch;

import java.util.Optional;

/**
 * 배치 작업 스냅샷 저장소.
 */
public interface JobSnapshotRepository {

    /**
     * 스냅샷을 저장합니다. 같은 작업 ID의 이전 스냅샷은 덮어씁니다.
     */
    void save(JobSnapshot snapshot);

    Optional<JobSnapshot> findByJobId(String jobId);
}
