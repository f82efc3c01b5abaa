package com.orderhub.application.scheduling;

import com.orderhub.application.batch.BatchProcessor;
import com.orderhub.application.event.EventBatchJobs;
import com.orderhub.application.loyalty.LoyaltyBatchJobs;
import com.orderhub.application.notification.NotificationBatchJobs;
import com.orderhub.config.AsyncConfig;
import com.orderhub.config.SchedulingProperties;
import com.orderhub.domain.batch.BatchJobParameters;
import com.orderhub.domain.batch.BatchJobType;
import com.orderhub.domain.batch.JobSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 배치/스케줄 작업의 진입점.
 * <p>
 * 초기화 시 배치 작업 유형별 핸들러, 기본 반복 작업, 이벤트/쿠폰 기반 일회성 작업을 등록합니다.
 * 배치 실행은 {@link BatchProcessor}에, 반복 작업은 {@link RecurringTaskScheduler}에,
 * 일회성 작업은 {@link OneTimeJobScheduler}에 위임합니다.
 * </p>
 * <p>
 * <b>기본 반복 작업 (scheduling.timezone 기준):</b>
 * <ul>
 *   <li>loyalty-points-expiry: 매일 03:00</li>
 *   <li>daily-notification-digest: 매일 09:00</li>
 *   <li>monthly-tier-evaluation: 매월 1일 02:00</li>
 *   <li>hourly-event-update: 매시 30분</li>
 *   <li>notification-cleanup: 매일 04:00</li>
 * </ul>
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@Component
public class SchedulingManager {

    record DefaultSchedule(String taskId, String cronExpression, BatchJobType jobType) {
    }

    static final List<DefaultSchedule> DEFAULT_SCHEDULES = List.of(
        new DefaultSchedule("loyalty-points-expiry", "0 0 3 * * *", BatchJobType.LOYALTY_POINTS_EXPIRY),
        new DefaultSchedule("daily-notification-digest", "0 0 9 * * *", BatchJobType.NOTIFICATION_DAILY_DIGEST),
        new DefaultSchedule("monthly-tier-evaluation", "0 0 2 1 * *", BatchJobType.LOYALTY_TIER_EVALUATION),
        new DefaultSchedule("hourly-event-update", "0 30 * * * *", BatchJobType.EVENT_STATUS_SYNC),
        new DefaultSchedule("notification-cleanup", "0 0 4 * * *", BatchJobType.NOTIFICATION_CLEANUP)
    );

    private final BatchProcessor batchProcessor;
    private final OneTimeJobScheduler oneTimeJobScheduler;
    private final RecurringTaskScheduler recurringTaskScheduler;
    private final DynamicScheduleRegistrar dynamicScheduleRegistrar;
    private final BatchJobHandlerRegistry handlerRegistry;
    private final LoyaltyBatchJobs loyaltyBatchJobs;
    private final NotificationBatchJobs notificationBatchJobs;
    private final EventBatchJobs eventBatchJobs;
    private final SchedulingProperties properties;
    private final ExecutorService jobDispatchExecutor;

    private final AtomicBoolean initialized = new AtomicBoolean(false);

    public SchedulingManager(
        BatchProcessor batchProcessor,
        OneTimeJobScheduler oneTimeJobScheduler,
        RecurringTaskScheduler recurringTaskScheduler,
        DynamicScheduleRegistrar dynamicScheduleRegistrar,
        BatchJobHandlerRegistry handlerRegistry,
        LoyaltyBatchJobs loyaltyBatchJobs,
        NotificationBatchJobs notificationBatchJobs,
        EventBatchJobs eventBatchJobs,
        SchedulingProperties properties,
        @Qualifier(AsyncConfig.JOB_DISPATCH_EXECUTOR) ExecutorService jobDispatchExecutor
    ) {
        this.batchProcessor = batchProcessor;
        this.oneTimeJobScheduler = oneTimeJobScheduler;
        this.recurringTaskScheduler = recurringTaskScheduler;
        this.dynamicScheduleRegistrar = dynamicScheduleRegistrar;
        this.handlerRegistry = handlerRegistry;
        this.loyaltyBatchJobs = loyaltyBatchJobs;
        this.notificationBatchJobs = notificationBatchJobs;
        this.eventBatchJobs = eventBatchJobs;
        this.properties = properties;
        this.jobDispatchExecutor = jobDispatchExecutor;
    }

    /**
     * 스케줄링을 초기화합니다. 두 번째 호출부터는 아무 것도 하지 않습니다.
     */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            log.info("스케줄링 매니저가 이미 초기화되어 있습니다.");
            return;
        }
        try {
            registerBatchJobHandlers();
            if (properties.recurringEnabled()) {
                registerDefaultSchedules();
            }
            dynamicScheduleRegistrar.registerAll();
            log.info("스케줄링 매니저 초기화 완료. (handlers: {}, recurringTasks: {}, oneTimeJobs: {})",
                handlerRegistry.registeredTypes().size(),
                recurringTaskScheduler.getRegisteredTasks().size(),
                oneTimeJobScheduler.getJobs().size());
        } catch (RuntimeException e) {
            initialized.set(false);
            log.error("스케줄링 매니저 초기화 실패.", e);
            throw e;
        }
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * 지정한 시각에 한 번 실행되는 작업을 예약합니다.
     *
     * @param jobId 작업 ID
     * @param executeTime 실행 시각 (현재 이후여야 함)
     * @param task 실행할 작업
     * @return 예약 여부
     */
    public boolean scheduleOneTimeJob(String jobId, Instant executeTime, Runnable task) {
        return oneTimeJobScheduler.schedule(jobId, executeTime, task);
    }

    /**
     * 배치 작업을 즉시 실행하고 끝날 때까지 기다립니다.
     *
     * @param jobType 배치 작업 유형 이름
     * @param parameters 실행 파라미터
     * @return 종료 시점의 작업 스냅샷
     * @throws com.orderhub.support.error.CoreException 지원하지 않는 유형인 경우 (BAD_REQUEST)
     */
    public JobSnapshot executeImmediateBatchJob(String jobType, BatchJobParameters parameters) {
        return executeImmediateBatchJob(BatchJobType.from(jobType), parameters);
    }

    public JobSnapshot executeImmediateBatchJob(BatchJobType jobType, BatchJobParameters parameters) {
        BatchJobHandler handler = handlerRegistry.get(jobType);
        log.info("배치 작업 즉시 실행. (유형: {})", jobType);
        return handler.handle(parameters != null ? parameters : BatchJobParameters.empty());
    }

    /**
     * 배치 작업을 별도 스레드에서 실행합니다. 유형 검증은 호출 스레드에서 즉시 수행됩니다.
     *
     * @param jobType 배치 작업 유형 이름
     * @param parameters 실행 파라미터
     * @return 작업 완료 시 스냅샷으로 완료되는 future
     */
    public CompletableFuture<JobSnapshot> triggerBatchJob(String jobType, BatchJobParameters parameters) {
        BatchJobType type = BatchJobType.from(jobType);
        BatchJobHandler handler = handlerRegistry.get(type);
        BatchJobParameters resolved = parameters != null ? parameters : BatchJobParameters.empty();
        CompletableFuture<JobSnapshot> future = CompletableFuture.supplyAsync(() -> handler.handle(resolved), jobDispatchExecutor);
        future.whenComplete((snapshot, t) -> {
            if (t != null) {
                log.error("배치 작업 비동기 실행 실패. (유형: {})", type, t);
            }
        });
        return future;
    }

    public Optional<JobSnapshot> getJobStatus(String jobId) {
        return batchProcessor.getJobStatus(jobId);
    }

    public List<JobSnapshot> getRunningJobs() {
        return batchProcessor.getRunningJobs();
    }

    public List<RecurringTaskInfo> getScheduledTasks() {
        return recurringTaskScheduler.getRegisteredTasks();
    }

    public List<OneTimeJob> getOneTimeJobs() {
        return oneTimeJobScheduler.getJobs();
    }

    /**
     * 작업을 취소합니다. 실행 중인 배치 작업, 일회성 작업, 반복 작업 순서로 찾습니다.
     *
     * @param jobId 작업 ID
     * @return 취소 여부
     */
    public boolean cancelJob(String jobId) {
        if (batchProcessor.cancelJob(jobId)) {
            return true;
        }
        if (oneTimeJobScheduler.cancel(jobId)) {
            return true;
        }
        return recurringTaskScheduler.stopTask(jobId);
    }

    /**
     * 모든 반복 작업을 중지하고 예약된 일회성 작업을 취소합니다.
     * 초기화되지 않은 상태에서도 호출할 수 있습니다.
     */
    public void shutdown() {
        recurringTaskScheduler.stopAllTasks();
        int cancelled = oneTimeJobScheduler.cancelAll();
        initialized.set(false);
        log.info("스케줄링 매니저 종료. (취소된 일회성 작업: {})", cancelled);
    }

    private void registerBatchJobHandlers() {
        handlerRegistry.register(BatchJobType.LOYALTY_POINTS_EXPIRY, params -> loyaltyBatchJobs.processPointsExpiry());
        handlerRegistry.register(BatchJobType.LOYALTY_TIER_EVALUATION, params -> loyaltyBatchJobs.evaluateTiers());
        handlerRegistry.register(BatchJobType.LOYALTY_FESTIVAL_BONUS, loyaltyBatchJobs::grantFestivalBonus);
        handlerRegistry.register(BatchJobType.NOTIFICATION_DAILY_DIGEST, params -> notificationBatchJobs.sendDailyDigest());
        handlerRegistry.register(BatchJobType.NOTIFICATION_BULK_PUSH, notificationBatchJobs::sendBulkPush);
        handlerRegistry.register(BatchJobType.NOTIFICATION_CLEANUP, notificationBatchJobs::cleanupOldNotifications);
        handlerRegistry.register(BatchJobType.EVENT_STATUS_SYNC, params -> eventBatchJobs.syncEventStatuses());
    }

    private void registerDefaultSchedules() {
        for (DefaultSchedule schedule : DEFAULT_SCHEDULES) {
            recurringTaskScheduler.scheduleTask(
                schedule.taskId(),
                schedule.cronExpression(),
                () -> executeImmediateBatchJob(schedule.jobType(), BatchJobParameters.empty()),
                properties.timezone()
            );
        }
    }
}
