package com.orderhub.infrastructure.batch;

import com.orderhub.config.SchedulingProperties;
import com.orderhub.domain.batch.JobSnapshot;
import com.orderhub.domain.batch.JobStatus;
import com.orderhub.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JobSnapshotRepositoryImpl 테스트.
 */
class JobSnapshotRepositoryImplTest {

    private static final Instant NOW = Instant.parse("2024-12-15T03:00:00Z");

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @DisplayName("스냅샷은 batch_job:{jobId} 키에 설정된 TTL로 저장된다.")
    @Test
    void savesUnderPrefixedKeyWithTtl() {
        // arrange
        SchedulingProperties properties = new SchedulingProperties(null, null, Duration.ofHours(6), null, null, null, null);
        JobSnapshotRepositoryImpl repository = new JobSnapshotRepositoryImpl(store, properties);
        JobSnapshot snapshot = new JobSnapshot("job-1", "test", JobStatus.RUNNING, 10, 3, 0, 30, NOW, null, null, null, NOW);

        // act
        repository.save(snapshot);

        // assert
        assertThat(store.containsKey("batch_job:job-1")).isTrue();
        assertThat(store.ttlOf("batch_job:job-1")).hasValue(Duration.ofHours(6));
        assertThat(repository.findByJobId("job-1")).hasValue(snapshot);
    }

    @DisplayName("같은 작업의 스냅샷은 마지막 값으로 덮어쓴다.")
    @Test
    void overwritesPreviousSnapshot() {
        // arrange
        JobSnapshotRepositoryImpl repository = new JobSnapshotRepositoryImpl(store, SchedulingProperties.defaults());
        repository.save(new JobSnapshot("job-1", "test", JobStatus.RUNNING, 10, 3, 0, 30, NOW, null, null, null, NOW));
        JobSnapshot last = new JobSnapshot("job-1", "test", JobStatus.COMPLETED, 10, 10, 0, 100, NOW,
            NOW.plusSeconds(5), 5000L, null, NOW.plusSeconds(5));

        // act
        repository.save(last);

        // assert
        assertThat(repository.findByJobId("job-1")).hasValue(last);
        assertThat(store.ttlOf("batch_job:job-1")).hasValue(Duration.ofHours(24));
    }

    @DisplayName("저장된 적 없는 작업은 빈 값을 반환한다.")
    @Test
    void returnsEmpty_whenMissing() {
        // arrange
        JobSnapshotRepositoryImpl repository = new JobSnapshotRepositoryImpl(store, SchedulingProperties.defaults());

        // act & assert
        assertThat(repository.findByJobId("unknown")).isEmpty();
    }
}
