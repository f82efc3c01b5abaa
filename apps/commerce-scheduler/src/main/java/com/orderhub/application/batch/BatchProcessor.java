package com.orderhub.application.batch;

import com.orderhub.config.AsyncConfig;
import com.orderhub.domain.batch.JobConfig;
import com.orderhub.domain.batch.JobInstance;
import com.orderhub.domain.batch.JobListener;
import com.orderhub.domain.batch.JobSnapshot;
import com.orderhub.domain.batch.JobSnapshotRepository;
import com.orderhub.infrastructure.batch.BatchJobMetrics;
import com.orderhub.infrastructure.batch.DelayProvider;
import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 대용량 배치 작업 실행기.
 * <p>
 * 데이터 소스를 {@code batchSize} 단위 페이지로 나누어 처리하며, 작업마다 생성되는 {@link AsyncSemaphore}로
 * 동시에 처리되는 페이지 수를 {@code maxConcurrency}로 제한합니다.
 * 페이지 안의 아이템은 서로 병렬로 처리되고, 실패한 아이템은 지수 백오프로 재시도됩니다.
 * </p>
 * <p>
 * <b>실패 처리:</b>
 * <ul>
 *   <li>아이템 실패: {@code retryAttempts}회 시도 후에도 실패하면 실패 건수로 집계하고 작업은 계속됩니다.</li>
 *   <li>페이지 조회 실패: 재시도하지 않으며, 나머지 페이지가 모두 끝난 뒤 작업을 FAILED로 전이하고 예외를 호출자에게 전파합니다.</li>
 *   <li>스냅샷 저장 실패와 콜백 예외: 로그만 남기고 작업 결과에 영향을 주지 않습니다.</li>
 * </ul>
 * </p>
 * <p>
 * <b>취소:</b>
 * 취소는 선점하지 않습니다. 이미 시작된 페이지는 끝까지 실행되지만 취소 이후의 집계는 반영되지 않습니다.
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@Component
public class BatchProcessor {

    private final JobSnapshotRepository jobSnapshotRepository;
    private final ExecutorService batchExecutor;
    private final DelayProvider delayProvider;
    private final IntervalFunction retryIntervalFunction;
    private final BatchJobMetrics metrics;
    private final Clock clock;

    private final ConcurrentMap<String, JobInstance> runningJobs = new ConcurrentHashMap<>();

    public BatchProcessor(
        JobSnapshotRepository jobSnapshotRepository,
        @Qualifier(AsyncConfig.BATCH_EXECUTOR) ExecutorService batchExecutor,
        DelayProvider delayProvider,
        IntervalFunction retryIntervalFunction,
        BatchJobMetrics metrics,
        Clock clock
    ) {
        this.jobSnapshotRepository = jobSnapshotRepository;
        this.batchExecutor = batchExecutor;
        this.delayProvider = delayProvider;
        this.retryIntervalFunction = retryIntervalFunction;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 배치 작업을 끝까지 실행합니다.
     * <p>
     * 호출 스레드는 실패 여부와 관계없이 모든 페이지가 끝날 때까지 대기합니다.
     * 실패한 페이지가 있으면 가장 먼저 발생한 예외로 작업을 FAILED 처리합니다.
     * </p>
     *
     * @param config 작업 설정
     * @param <T> 아이템 타입
     * @return 종료 시점의 작업 스냅샷 (COMPLETED 또는 CANCELLED)
     * @throws CoreException 같은 ID의 작업이 이미 실행 중인 경우 (CONFLICT)
     * @throws RuntimeException 데이터 소스 조회 실패 등으로 작업이 FAILED 된 경우 원인 예외
     */
    public <T> JobSnapshot executeBatchJob(JobConfig<T> config) {
        String jobId = config.jobId();
        JobInstance instance = JobInstance.start(jobId, config.jobType(), clock.instant());
        if (runningJobs.putIfAbsent(jobId, instance) != null) {
            throw new CoreException(ErrorType.CONFLICT,
                String.format("이미 실행 중인 배치 작업입니다. (jobId: %s)", jobId));
        }
        log.info("배치 작업 시작. (jobId: {}, jobType: {})", jobId, config.jobType());

        try {
            long totalItems = config.dataSource().getTotalCount();
            instance.initializeTotal(totalItems);
            persist(instance);
            log.info("배치 작업 대상 건수 확인. (jobId: {}, totalItems: {}, batchSize: {}, maxConcurrency: {})",
                jobId, totalItems, config.batchSize(), config.maxConcurrency());

            if (totalItems > 0) {
                runBatches(config, instance, totalItems);
            }

            if (!instance.complete(clock.instant())) {
                JobSnapshot snapshot = instance.snapshot(clock.instant());
                log.info("배치 작업이 실행 중 종료되어 완료 처리를 생략합니다. (jobId: {}, status: {})",
                    jobId, snapshot.status());
                return snapshot;
            }
            JobSnapshot snapshot = persist(instance);
            metrics.recordJobFinished(config.jobType(), snapshot.status().name(), Duration.ofMillis(snapshot.durationMillis()));
            log.info("배치 작업 완료. (jobId: {}, processed: {}, failed: {}, duration: {}ms)",
                jobId, snapshot.processedItems(), snapshot.failedItems(), snapshot.durationMillis());
            notifyComplete(config.listener(), snapshot);
            return snapshot;
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            handleFailure(config, instance, cause);
            throw asRuntimeException(cause);
        } finally {
            runningJobs.remove(jobId, instance);
        }
    }

    /**
     * 작업 상태를 조회합니다.
     * <p>
     * 실행 중인 작업은 현재 상태를, 종료된 작업은 저장소에 남아 있는 마지막 스냅샷을 반환합니다.
     * </p>
     *
     * @param jobId 작업 ID
     * @return 작업 스냅샷 (없으면 빈 Optional)
     */
    public Optional<JobSnapshot> getJobStatus(String jobId) {
        JobInstance instance = runningJobs.get(jobId);
        if (instance != null) {
            return Optional.of(instance.snapshot(clock.instant()));
        }
        return jobSnapshotRepository.findByJobId(jobId);
    }

    public List<JobSnapshot> getRunningJobs() {
        List<JobSnapshot> snapshots = new ArrayList<>();
        for (JobInstance instance : runningJobs.values()) {
            snapshots.add(instance.snapshot(clock.instant()));
        }
        return snapshots;
    }

    public boolean isRunning(String jobId) {
        return runningJobs.containsKey(jobId);
    }

    /**
     * 실행 중인 작업을 취소합니다.
     *
     * @param jobId 작업 ID
     * @return 취소 여부 (실행 중인 작업이 없으면 false)
     */
    public boolean cancelJob(String jobId) {
        JobInstance instance = runningJobs.get(jobId);
        if (instance == null || !instance.cancel(clock.instant())) {
            return false;
        }
        runningJobs.remove(jobId, instance);
        JobSnapshot snapshot = persist(instance);
        metrics.recordJobFinished(snapshot.jobType(), snapshot.status().name(), Duration.ofMillis(snapshot.durationMillis()));
        log.info("배치 작업 취소. (jobId: {}, processed: {}, failed: {})",
            jobId, snapshot.processedItems(), snapshot.failedItems());
        return true;
    }

    private <T> void runBatches(JobConfig<T> config, JobInstance instance, long totalItems) {
        AsyncSemaphore semaphore = new AsyncSemaphore(config.maxConcurrency());
        long batchCount = (totalItems + config.batchSize() - 1) / config.batchSize();

        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        List<CompletableFuture<Void>> batches = new ArrayList<>();
        for (long i = 0; i < batchCount; i++) {
            long offset = i * config.batchSize();
            CompletableFuture<Void> batch = semaphore.acquire()
                .thenCompose(permit -> withPermit(permit, () -> processBatch(config, instance, offset)))
                .whenComplete((ignored, t) -> {
                    if (t != null) {
                        firstFailure.compareAndSet(null, t);
                    }
                });
            batches.add(batch);
        }

        // 실패한 페이지가 있어도 모든 페이지가 끝난 뒤에 결과를 판단한다
        CompletableFuture.allOf(batches.toArray(new CompletableFuture[0]))
            .handle((ignored, t) -> null)
            .join();
        Throwable failure = firstFailure.get();
        if (failure != null) {
            throw new CompletionException(failure);
        }
    }

    private CompletableFuture<Void> withPermit(AsyncSemaphore.Permit permit, Supplier<CompletableFuture<Void>> work) {
        CompletableFuture<Void> future;
        try {
            future = work.get();
        } catch (RuntimeException e) {
            permit.release();
            return CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((ignored, t) -> permit.release());
    }

    private <T> CompletableFuture<Void> processBatch(JobConfig<T> config, JobInstance instance, long offset) {
        return CompletableFuture
            .supplyAsync(() -> config.dataSource().getBatch(offset, config.batchSize()), batchExecutor)
            .thenCompose(items -> {
                if (items == null || items.isEmpty()) {
                    return CompletableFuture.completedFuture(null);
                }
                List<CompletableFuture<Boolean>> results = new ArrayList<>(items.size());
                for (T item : items) {
                    results.add(CompletableFuture.supplyAsync(() -> processItemWithRetry(config, item), batchExecutor));
                }
                return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]))
                    .thenAccept(ignored -> recordBatchResult(config, instance, offset, results));
            });
    }

    private <T> boolean processItemWithRetry(JobConfig<T> config, T item) {
        int maxAttempts = config.retryAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                config.processor().process(item);
                return true;
            } catch (Exception e) {
                if (attempt == maxAttempts) {
                    log.warn("아이템 처리 실패. 재시도 횟수를 모두 소진했습니다. (jobId: {}, attempts: {})",
                        config.jobId(), attempt, e);
                    return false;
                }
                long backoffMillis = retryIntervalFunction.apply(attempt);
                log.warn("아이템 처리 실패. {}ms 후 재시도합니다. (jobId: {}, attempt: {}/{}, error: {})",
                    backoffMillis, config.jobId(), attempt, maxAttempts, e.getMessage());
                metrics.recordRetry(config.jobType());
                try {
                    delayProvider.delay(Duration.ofMillis(backoffMillis));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("재시도 대기 중 인터럽트되어 아이템을 실패로 처리합니다. (jobId: {})", config.jobId());
                    return false;
                }
            }
        }
        return false;
    }

    private <T> void recordBatchResult(
        JobConfig<T> config,
        JobInstance instance,
        long offset,
        List<CompletableFuture<Boolean>> results
    ) {
        long succeeded = results.stream().filter(CompletableFuture::join).count();
        long failed = results.size() - succeeded;
        JobSnapshot snapshot;
        // 집계 반영과 저장을 한 번에 수행해 종료 전이 이후에는 RUNNING 스냅샷이 저장되지 않는다
        synchronized (instance) {
            if (!instance.recordBatch(succeeded, failed)) {
                log.debug("종료된 작업의 배치 결과는 반영하지 않습니다. (jobId: {}, offset: {})", config.jobId(), offset);
                return;
            }
            snapshot = persist(instance);
        }
        metrics.recordItems(config.jobType(), succeeded, failed);
        log.debug("배치 처리 완료. (jobId: {}, offset: {}, succeeded: {}, failed: {}, progress: {}%)",
            config.jobId(), offset, succeeded, failed, snapshot.progress());
        notifyProgress(config.listener(), snapshot);
    }

    private <T> void handleFailure(JobConfig<T> config, JobInstance instance, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (!instance.fail(message, clock.instant())) {
            log.warn("이미 종료된 작업에서 예외가 발생했습니다. (jobId: {}, status: {})",
                config.jobId(), instance.getStatus(), cause);
            return;
        }
        JobSnapshot snapshot = persist(instance);
        metrics.recordJobFinished(config.jobType(), snapshot.status().name(), Duration.ofMillis(snapshot.durationMillis()));
        log.error("배치 작업 실패. (jobId: {}, processed: {}, failed: {})",
            config.jobId(), snapshot.processedItems(), snapshot.failedItems(), cause);
        notifyError(config.listener(), snapshot, cause);
    }

    /**
     * 현재 상태의 스냅샷을 저장합니다.
     * <p>
     * 스냅샷 생성과 저장은 {@link JobInstance}의 모니터 안에서 수행되므로 상태 전이와 저장 순서가 어긋나지 않습니다.
     * </p>
     */
    private JobSnapshot persist(JobInstance instance) {
        synchronized (instance) {
            JobSnapshot snapshot = instance.snapshot(clock.instant());
            try {
                jobSnapshotRepository.save(snapshot);
            } catch (Exception e) {
                log.warn("배치 작업 스냅샷 저장 실패. (jobId: {}, status: {})", snapshot.jobId(), snapshot.status(), e);
            }
            return snapshot;
        }
    }

    private void notifyProgress(JobListener listener, JobSnapshot snapshot) {
        try {
            listener.onProgress(snapshot);
        } catch (Exception e) {
            log.warn("진행률 콜백 실행 실패. (jobId: {})", snapshot.jobId(), e);
        }
    }

    private void notifyComplete(JobListener listener, JobSnapshot snapshot) {
        try {
            listener.onComplete(snapshot);
        } catch (Exception e) {
            log.warn("완료 콜백 실행 실패. (jobId: {})", snapshot.jobId(), e);
        }
    }

    private void notifyError(JobListener listener, JobSnapshot snapshot, Throwable cause) {
        try {
            listener.onError(snapshot, cause);
        } catch (Exception e) {
            log.warn("실패 콜백 실행 실패. (jobId: {})", snapshot.jobId(), e);
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException asRuntimeException(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new CoreException(ErrorType.INTERNAL_ERROR, cause.getMessage(), cause);
    }
}
