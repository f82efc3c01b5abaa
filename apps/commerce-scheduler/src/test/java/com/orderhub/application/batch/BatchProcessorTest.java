package com.orderhub.application.batch;

import com.orderhub.domain.batch.BatchDataSource;
import com.orderhub.domain.batch.JobConfig;
import com.orderhub.domain.batch.JobListener;
import com.orderhub.domain.batch.JobSnapshot;
import com.orderhub.domain.batch.JobSnapshotRepository;
import com.orderhub.domain.batch.JobStatus;
import com.orderhub.domain.batch.ListBatchDataSource;
import com.orderhub.infrastructure.batch.JobSnapshotRepositoryImpl;
import com.orderhub.store.InMemoryKeyValueStore;
import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;
import com.orderhub.testutil.BatchProcessorTestUtil;
import com.orderhub.testutil.RecordingDelayProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchProcessor 테스트.
 * <p>
 * 메모리 저장소와 실제 스레드 풀로 구성된 처리기를 사용합니다.
 * 재시도 대기는 {@link RecordingDelayProvider}로 기록만 합니다.
 * </p>
 */
class BatchProcessorTest {

    private ExecutorService executor;
    private InMemoryKeyValueStore store;
    private JobSnapshotRepositoryImpl repository;
    private RecordingDelayProvider delayProvider;
    private SimpleMeterRegistry meterRegistry;
    private BatchProcessor batchProcessor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        store = new InMemoryKeyValueStore();
        repository = BatchProcessorTestUtil.newRepository(store);
        delayProvider = new RecordingDelayProvider();
        meterRegistry = new SimpleMeterRegistry();
        batchProcessor = BatchProcessorTestUtil.newProcessor(repository, executor, delayProvider, meterRegistry);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static List<Integer> items(int count) {
        return IntStream.range(0, count).boxed().toList();
    }

    @Nested
    @DisplayName("정상 처리")
    class Completion {

        @DisplayName("모든 아이템을 페이지 단위로 처리하고 COMPLETED 스냅샷을 반환한다.")
        @Test
        void processesAllItemsInPages() {
            // arrange
            AtomicInteger processed = new AtomicInteger();
            List<JobSnapshot> progressEvents = new CopyOnWriteArrayList<>();
            AtomicReference<JobSnapshot> completed = new AtomicReference<>();
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-2500")
                .jobType("test")
                .items(items(2500))
                .batchSize(1000)
                .maxConcurrency(2)
                .processor(item -> processed.incrementAndGet())
                .listener(new JobListener() {
                    @Override
                    public void onProgress(JobSnapshot snapshot) {
                        progressEvents.add(snapshot);
                    }

                    @Override
                    public void onComplete(JobSnapshot snapshot) {
                        completed.set(snapshot);
                    }
                })
                .build();

            // act
            JobSnapshot result = batchProcessor.executeBatchJob(config);

            // assert
            assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(result.totalItems()).isEqualTo(2500);
            assertThat(result.processedItems()).isEqualTo(2500);
            assertThat(result.failedItems()).isZero();
            assertThat(result.progress()).isEqualTo(100);
            assertThat(processed.get()).isEqualTo(2500);
            assertThat(progressEvents).hasSize(3);
            assertThat(progressEvents).allSatisfy(snapshot -> assertThat(snapshot.progress()).isLessThanOrEqualTo(99));
            assertThat(completed.get()).isEqualTo(result);
            assertThat(batchProcessor.isRunning("job-2500")).isFalse();
        }

        @DisplayName("아이템이 없으면 페이지를 조회하지 않고 바로 완료한다.")
        @Test
        void completesImmediately_whenNoItems() {
            // arrange
            AtomicInteger fetches = new AtomicInteger();
            BatchDataSource<Integer> dataSource = new BatchDataSource<>() {
                @Override
                public long getTotalCount() {
                    return 0;
                }

                @Override
                public List<Integer> getBatch(long offset, int limit) {
                    fetches.incrementAndGet();
                    return List.of();
                }
            };
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-empty")
                .jobType("test")
                .dataSource(dataSource)
                .processor(item -> item)
                .build();

            // act
            JobSnapshot result = batchProcessor.executeBatchJob(config);

            // assert
            assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(result.progress()).isEqualTo(100);
            assertThat(fetches.get()).isZero();
        }

        @DisplayName("재시도를 소진한 아이템은 실패로 집계되고 작업은 완료된다.")
        @Test
        void countsExhaustedItemsAsFailed() {
            // arrange
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-partial")
                .jobType("test")
                .items(items(10))
                .retryAttempts(1)
                .processor(item -> {
                    if (item < 3) {
                        throw new IllegalStateException("처리 실패: " + item);
                    }
                    return item;
                })
                .build();

            // act
            JobSnapshot result = batchProcessor.executeBatchJob(config);

            // assert
            assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(result.processedItems()).isEqualTo(7);
            assertThat(result.failedItems()).isEqualTo(3);
            assertThat(delayProvider.getDelays()).isEmpty();
        }

        @DisplayName("종료된 작업의 스냅샷은 저장소에서 조회된다.")
        @Test
        void persistsFinalSnapshot() {
            // arrange
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-persist")
                .jobType("test")
                .items(items(5))
                .processor(item -> item)
                .build();

            // act
            batchProcessor.executeBatchJob(config);

            // assert
            assertThat(batchProcessor.getJobStatus("job-persist"))
                .hasValueSatisfying(snapshot -> assertThat(snapshot.status()).isEqualTo(JobStatus.COMPLETED));
            assertThat(store.ttlOf("batch_job:job-persist")).hasValue(Duration.ofHours(24));
        }

        @DisplayName("처리 건수가 메트릭으로 기록된다.")
        @Test
        void recordsItemMetrics() {
            // arrange
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-metrics")
                .jobType("metrics-test")
                .items(items(20))
                .batchSize(5)
                .processor(item -> item)
                .build();

            // act
            batchProcessor.executeBatchJob(config);

            // assert
            double succeeded = meterRegistry.get("batch.job.items")
                .tag("jobType", "metrics-test")
                .tag("result", "success")
                .counter()
                .count();
            assertThat(succeeded).isEqualTo(20.0);
        }
    }

    @Nested
    @DisplayName("재시도")
    class Retry {

        @DisplayName("실패한 아이템은 1초, 2초 간격으로 재시도된다.")
        @Test
        void retriesWithExponentialBackoff() {
            // arrange
            Map<Integer, AtomicInteger> attempts = new ConcurrentHashMap<>();
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-retry")
                .jobType("test")
                .items(List.of(1))
                .retryAttempts(3)
                .processor(item -> {
                    int attempt = attempts.computeIfAbsent(item, key -> new AtomicInteger()).incrementAndGet();
                    if (attempt < 3) {
                        throw new IllegalStateException("일시적 오류");
                    }
                    return item;
                })
                .build();

            // act
            JobSnapshot result = batchProcessor.executeBatchJob(config);

            // assert
            assertThat(result.processedItems()).isEqualTo(1);
            assertThat(result.failedItems()).isZero();
            assertThat(attempts.get(1).get()).isEqualTo(3);
            assertThat(delayProvider.getDelays()).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(2000));
        }

        @DisplayName("모든 시도가 실패하면 마지막 시도 뒤에는 대기하지 않는다.")
        @Test
        void doesNotDelayAfterLastAttempt() {
            // arrange
            AtomicInteger calls = new AtomicInteger();
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-exhaust")
                .jobType("test")
                .items(List.of(1))
                .retryAttempts(3)
                .processor(item -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("영구 오류");
                })
                .build();

            // act
            JobSnapshot result = batchProcessor.executeBatchJob(config);

            // assert
            assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(result.failedItems()).isEqualTo(1);
            assertThat(calls.get()).isEqualTo(3);
            assertThat(delayProvider.getDelays()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("실패")
    class Failure {

        @DisplayName("페이지 조회가 실패하면 FAILED로 기록하고 예외를 전파한다.")
        @Test
        void failsJob_whenBatchFetchFails() {
            // arrange
            AtomicReference<Throwable> reported = new AtomicReference<>();
            BatchDataSource<Integer> dataSource = new BatchDataSource<>() {
                @Override
                public long getTotalCount() {
                    return 10;
                }

                @Override
                public List<Integer> getBatch(long offset, int limit) {
                    throw new IllegalStateException("페이지 조회 실패");
                }
            };
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-fetch-fail")
                .jobType("test")
                .dataSource(dataSource)
                .processor(item -> item)
                .listener(new JobListener() {
                    @Override
                    public void onError(JobSnapshot snapshot, Throwable error) {
                        reported.set(error);
                    }
                })
                .build();

            // act & assert
            assertThatThrownBy(() -> batchProcessor.executeBatchJob(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("페이지 조회 실패");
            assertThat(reported.get()).isInstanceOf(IllegalStateException.class);
            assertThat(batchProcessor.isRunning("job-fetch-fail")).isFalse();
            assertThat(batchProcessor.getJobStatus("job-fetch-fail"))
                .hasValueSatisfying(snapshot -> {
                    assertThat(snapshot.status()).isEqualTo(JobStatus.FAILED);
                    assertThat(snapshot.error()).isEqualTo("페이지 조회 실패");
                });
        }

        @DisplayName("전체 건수 조회가 실패해도 FAILED로 기록된다.")
        @Test
        void failsJob_whenTotalCountFails() {
            // arrange
            BatchDataSource<Integer> dataSource = new BatchDataSource<>() {
                @Override
                public long getTotalCount() {
                    throw new IllegalStateException("건수 조회 실패");
                }

                @Override
                public List<Integer> getBatch(long offset, int limit) {
                    return List.of();
                }
            };
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-count-fail")
                .jobType("test")
                .dataSource(dataSource)
                .processor(item -> item)
                .build();

            // act & assert
            assertThatThrownBy(() -> batchProcessor.executeBatchJob(config))
                .isInstanceOf(IllegalStateException.class);
            assertThat(batchProcessor.getJobStatus("job-count-fail"))
                .hasValueSatisfying(snapshot -> assertThat(snapshot.status()).isEqualTo(JobStatus.FAILED));
        }

        @DisplayName("페이지 하나가 실패해도 나머지 페이지가 모두 끝난 뒤에 실패를 반환한다.")
        @Test
        void waitsForRemainingPages_whenOnePageFails() throws Exception {
            // arrange
            AtomicInteger processed = new AtomicInteger();
            List<Integer> all = items(6);
            BatchDataSource<Integer> dataSource = new BatchDataSource<>() {
                @Override
                public long getTotalCount() {
                    return all.size();
                }

                @Override
                public List<Integer> getBatch(long offset, int limit) {
                    if (offset == 0) {
                        throw new IllegalStateException("첫 페이지 조회 실패");
                    }
                    return new ArrayList<>(all.subList((int) offset, (int) Math.min(all.size(), offset + limit)));
                }
            };
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-partial-fail")
                .jobType("test")
                .dataSource(dataSource)
                .batchSize(2)
                .maxConcurrency(1)
                .processor(item -> {
                    Thread.sleep(50);
                    processed.incrementAndGet();
                    return item;
                })
                .build();

            // act
            assertThatThrownBy(() -> batchProcessor.executeBatchJob(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("첫 페이지 조회 실패");
            int processedAtReturn = processed.get();
            Thread.sleep(300);

            // assert
            assertThat(processedAtReturn).isEqualTo(4);
            assertThat(processed.get()).isEqualTo(processedAtReturn);
            assertThat(batchProcessor.getJobStatus("job-partial-fail"))
                .hasValueSatisfying(snapshot -> {
                    assertThat(snapshot.status()).isEqualTo(JobStatus.FAILED);
                    assertThat(snapshot.processedItems()).isEqualTo(4);
                });
        }

        @DisplayName("콜백에서 예외가 발생해도 작업 결과에는 영향이 없다.")
        @Test
        void toleratesListenerExceptions() {
            // arrange
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-listener")
                .jobType("test")
                .items(items(3))
                .processor(item -> item)
                .listener(new JobListener() {
                    @Override
                    public void onProgress(JobSnapshot snapshot) {
                        throw new IllegalStateException("progress listener");
                    }

                    @Override
                    public void onComplete(JobSnapshot snapshot) {
                        throw new IllegalStateException("complete listener");
                    }
                })
                .build();

            // act
            JobSnapshot result = batchProcessor.executeBatchJob(config);

            // assert
            assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(result.processedItems()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("동시 실행 제어")
    class Concurrency {

        @DisplayName("동시에 처리되는 페이지 수는 maxConcurrency를 넘지 않는다.")
        @Test
        void limitsConcurrentPages() {
            // arrange
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            List<Integer> all = items(100);
            BatchDataSource<Integer> dataSource = new BatchDataSource<>() {
                @Override
                public long getTotalCount() {
                    return all.size();
                }

                @Override
                public List<Integer> getBatch(long offset, int limit) {
                    int current = active.incrementAndGet();
                    maxActive.accumulateAndGet(current, Math::max);
                    try {
                        Thread.sleep(30);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    active.decrementAndGet();
                    return new ArrayList<>(all.subList((int) offset, (int) Math.min(all.size(), offset + limit)));
                }
            };
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-concurrency")
                .jobType("test")
                .dataSource(dataSource)
                .batchSize(10)
                .maxConcurrency(2)
                .processor(item -> item)
                .build();

            // act
            JobSnapshot result = batchProcessor.executeBatchJob(config);

            // assert
            assertThat(result.processedItems()).isEqualTo(100);
            assertThat(maxActive.get()).isBetween(1, 2);
        }

        @DisplayName("같은 ID의 작업이 실행 중이면 CONFLICT 예외가 발생한다.")
        @Test
        void rejectsDuplicateRunningJobId() throws Exception {
            // arrange
            CountDownLatch fetchStarted = new CountDownLatch(1);
            CountDownLatch releaseFetch = new CountDownLatch(1);
            JobConfig<Integer> blocking = blockingConfig("job-dup", fetchStarted, releaseFetch);
            CompletableFuture<JobSnapshot> first = CompletableFuture.supplyAsync(() -> batchProcessor.executeBatchJob(blocking));
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();

            JobConfig<Integer> duplicate = JobConfig.<Integer>builder()
                .jobId("job-dup")
                .jobType("test")
                .items(items(1))
                .processor(item -> item)
                .build();

            // act & assert
            assertThatThrownBy(() -> batchProcessor.executeBatchJob(duplicate))
                .isInstanceOf(CoreException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.CONFLICT);

            releaseFetch.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(JobStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("취소")
    class Cancel {

        @DisplayName("실행 중인 작업을 취소하면 CANCELLED로 종료되고 이후 결과는 반영되지 않는다.")
        @Test
        void cancelsRunningJob() throws Exception {
            // arrange
            CountDownLatch fetchStarted = new CountDownLatch(1);
            CountDownLatch releaseFetch = new CountDownLatch(1);
            JobConfig<Integer> config = blockingConfig("job-cancel", fetchStarted, releaseFetch);
            CompletableFuture<JobSnapshot> running = CompletableFuture.supplyAsync(() -> batchProcessor.executeBatchJob(config));
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(batchProcessor.getRunningJobs()).extracting(JobSnapshot::jobId).contains("job-cancel");

            // act
            boolean cancelled = batchProcessor.cancelJob("job-cancel");
            releaseFetch.countDown();
            JobSnapshot result = running.get(5, TimeUnit.SECONDS);

            // assert
            assertThat(cancelled).isTrue();
            assertThat(result.status()).isEqualTo(JobStatus.CANCELLED);
            assertThat(result.processedItems()).isZero();
            assertThat(batchProcessor.isRunning("job-cancel")).isFalse();
            assertThat(batchProcessor.getJobStatus("job-cancel"))
                .hasValueSatisfying(snapshot -> assertThat(snapshot.status()).isEqualTo(JobStatus.CANCELLED));
        }

        @DisplayName("진행 스냅샷 저장 중에 취소되어도 마지막으로 저장되는 상태는 CANCELLED다.")
        @Test
        void cancelledSnapshotIsLastWrite_whenProgressSaveIsSlow() throws Exception {
            // arrange
            CountDownLatch progressSaveStarted = new CountDownLatch(1);
            CountDownLatch releaseProgressSave = new CountDownLatch(1);
            JobSnapshotRepository slowRepository = new JobSnapshotRepository() {
                @Override
                public void save(JobSnapshot snapshot) {
                    if (snapshot.status() == JobStatus.RUNNING && snapshot.processedItems() > 0) {
                        progressSaveStarted.countDown();
                        try {
                            releaseProgressSave.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    repository.save(snapshot);
                }

                @Override
                public Optional<JobSnapshot> findByJobId(String jobId) {
                    return repository.findByJobId(jobId);
                }
            };
            BatchProcessor processor = BatchProcessorTestUtil.newProcessor(slowRepository, executor, delayProvider, meterRegistry);
            JobConfig<Integer> config = JobConfig.<Integer>builder()
                .jobId("job-slow-save")
                .jobType("test")
                .dataSource(new ListBatchDataSource<>(items(3)))
                .processor(item -> item)
                .build();
            CompletableFuture<JobSnapshot> running = CompletableFuture.supplyAsync(() -> processor.executeBatchJob(config));
            assertThat(progressSaveStarted.await(5, TimeUnit.SECONDS)).isTrue();

            // act
            CompletableFuture<Boolean> cancelling = CompletableFuture.supplyAsync(() -> processor.cancelJob("job-slow-save"));
            Thread.sleep(100);
            releaseProgressSave.countDown();
            boolean cancelled = cancelling.get(5, TimeUnit.SECONDS);
            JobSnapshot result = running.get(5, TimeUnit.SECONDS);

            // assert
            assertThat(cancelled).isTrue();
            assertThat(result.status()).isEqualTo(JobStatus.CANCELLED);
            assertThat(repository.findByJobId("job-slow-save"))
                .hasValueSatisfying(snapshot -> assertThat(snapshot.status()).isEqualTo(JobStatus.CANCELLED));
            assertThat(processor.getJobStatus("job-slow-save"))
                .hasValueSatisfying(snapshot -> assertThat(snapshot.status()).isEqualTo(JobStatus.CANCELLED));
        }

        @DisplayName("실행 중이 아닌 작업은 취소할 수 없다.")
        @Test
        void returnsFalse_whenJobNotRunning() {
            // act
            boolean cancelled = batchProcessor.cancelJob("unknown");

            // assert
            assertThat(cancelled).isFalse();
        }
    }

    private JobConfig<Integer> blockingConfig(String jobId, CountDownLatch fetchStarted, CountDownLatch releaseFetch) {
        BatchDataSource<Integer> dataSource = new BatchDataSource<>() {
            @Override
            public long getTotalCount() {
                return 3;
            }

            @Override
            public List<Integer> getBatch(long offset, int limit) {
                fetchStarted.countDown();
                try {
                    releaseFetch.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(1, 2, 3);
            }
        };
        return JobConfig.<Integer>builder()
            .jobId(jobId)
            .jobType("test")
            .dataSource(dataSource)
            .processor(item -> item)
            .build();
    }
}
