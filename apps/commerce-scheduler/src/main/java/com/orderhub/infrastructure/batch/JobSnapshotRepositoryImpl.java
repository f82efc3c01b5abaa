package com.orderhub.infrastructure.batch;

import com.orderhub.config.SchedulingProperties;
import com.orderhub.domain.batch.JobSnapshot;
import com.orderhub.domain.batch.JobSnapshotRepository;
import com.orderhub.store.KeyValueStore;
import com.orderhub.store.SimpleStoreKey;
import com.orderhub.store.StoreKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 키-값 저장소 기반 배치 작업 스냅샷 저장소.
 * <p>
 * 작업마다 {@code batch_job:{jobId}} 키 하나에 전체 상태를 덮어쓰며,
 * 마지막 쓰기 시점부터 {@code scheduling.snapshot-ttl} 동안 보관됩니다.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class JobSnapshotRepositoryImpl implements JobSnapshotRepository {

    static final String KEY_PREFIX = "batch_job:";

    private final KeyValueStore keyValueStore;
    private final SchedulingProperties schedulingProperties;

    @Override
    public void save(JobSnapshot snapshot) {
        keyValueStore.setWithExpiry(keyOf(snapshot.jobId()), snapshot);
    }

    @Override
    public Optional<JobSnapshot> findByJobId(String jobId) {
        return keyValueStore.get(keyOf(jobId));
    }

    private StoreKey<JobSnapshot> keyOf(String jobId) {
        return SimpleStoreKey.of(KEY_PREFIX + jobId, schedulingProperties.snapshotTtl(), JobSnapshot.class);
    }
}
