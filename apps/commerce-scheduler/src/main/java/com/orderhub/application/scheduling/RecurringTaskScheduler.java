package com.orderhub.application.scheduling;

import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * cron 기반 반복 작업 스케줄러.
 * <p>
 * Spring {@link TaskScheduler}에 {@link CronTrigger}로 작업을 등록하고 작업 ID 단위로 관리합니다.
 * 5필드 cron(분 시 일 월 요일)도 받으며, 이 경우 초 필드 0을 붙여 해석합니다.
 * </p>
 * <p>
 * 작업 실행은 시작/종료/소요 시간을 로그로 남기고 마지막 실행 기록을 보관합니다.
 * 작업 예외는 전파되지 않으며 다음 트리거 시각에 다시 실행됩니다.
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@Component
public class RecurringTaskScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Map<String, RegisteredTask> tasks = new ConcurrentHashMap<>();

    public RecurringTaskScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * 반복 작업을 등록합니다. 같은 ID의 작업이 있으면 중지하고 교체합니다.
     *
     * @param taskId 작업 ID
     * @param cronExpression cron 표현식 (5필드 또는 6필드)
     * @param task 실행할 작업
     * @param timezone cron 해석 시간대
     * @throws CoreException cron 표현식이 잘못된 경우 (BAD_REQUEST)
     */
    public synchronized void scheduleTask(String taskId, String cronExpression, Runnable task, ZoneId timezone) {
        String normalized = normalize(cronExpression);
        if (tasks.containsKey(taskId)) {
            log.warn("반복 작업 {}이(가) 이미 등록되어 있습니다. 기존 작업을 중지합니다.", taskId);
            stopTask(taskId);
        }

        RegisteredTask registered = new RegisteredTask(taskId, normalized, timezone, clock.instant());
        ScheduledFuture<?> future = taskScheduler.schedule(
            () -> execute(registered, task),
            new CronTrigger(normalized, timezone)
        );
        if (future == null) {
            throw new CoreException(ErrorType.INTERNAL_ERROR,
                String.format("반복 작업을 등록할 수 없습니다. 다음 실행 시각이 없습니다. (taskId: %s, cron: %s)", taskId, normalized));
        }
        registered.future = future;
        tasks.put(taskId, registered);
        log.info("반복 작업 등록 완료. (taskId: {}, cron: {}, timezone: {})", taskId, normalized, timezone);
    }

    /**
     * 반복 작업을 중지합니다.
     *
     * @param taskId 작업 ID
     * @return 중지 여부 (등록된 작업이 없으면 false)
     */
    public synchronized boolean stopTask(String taskId) {
        RegisteredTask registered = tasks.remove(taskId);
        if (registered == null) {
            return false;
        }
        registered.future.cancel(false);
        log.info("반복 작업 중지. (taskId: {})", taskId);
        return true;
    }

    public synchronized void stopAllTasks() {
        for (String taskId : new ArrayList<>(tasks.keySet())) {
            stopTask(taskId);
        }
        log.info("모든 반복 작업이 중지되었습니다.");
    }

    public List<RecurringTaskInfo> getRegisteredTasks() {
        return tasks.values().stream()
            .sorted(Comparator.comparing((RegisteredTask t) -> t.createdAt).thenComparing(t -> t.taskId))
            .map(RegisteredTask::toInfo)
            .toList();
    }

    public boolean isRegistered(String taskId) {
        return tasks.containsKey(taskId);
    }

    void execute(RegisteredTask registered, Runnable task) {
        Instant startedAt = clock.instant();
        String executionId = registered.taskId + "_" + startedAt.toEpochMilli();
        registered.executing.set(true);
        log.info("반복 작업 시작: {} ({})", registered.taskId, executionId);
        try {
            task.run();
            long duration = clock.millis() - startedAt.toEpochMilli();
            log.info("반복 작업 완료: {} ({}ms)", registered.taskId, duration);
            registered.lastExecution = new RecurringTaskInfo.TaskExecution(
                executionId, RecurringTaskInfo.TaskExecution.SUCCESS, startedAt, duration, null);
        } catch (Exception e) {
            long duration = clock.millis() - startedAt.toEpochMilli();
            log.error("반복 작업 실패: {} ({}ms)", registered.taskId, duration, e);
            registered.lastExecution = new RecurringTaskInfo.TaskExecution(
                executionId, RecurringTaskInfo.TaskExecution.FAILED, startedAt, duration, e.getMessage());
        } finally {
            registered.executing.set(false);
        }
    }

    static String normalize(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "cron 표현식은 필수입니다.");
        }
        String trimmed = cronExpression.trim();
        String normalized = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        if (!CronExpression.isValidExpression(normalized)) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("잘못된 cron 표현식입니다. (cron: %s)", cronExpression));
        }
        return normalized;
    }

    static final class RegisteredTask {
        private final String taskId;
        private final String cronExpression;
        private final ZoneId timezone;
        private final Instant createdAt;
        private final AtomicBoolean executing = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;
        private volatile RecurringTaskInfo.TaskExecution lastExecution;

        RegisteredTask(String taskId, String cronExpression, ZoneId timezone, Instant createdAt) {
            this.taskId = taskId;
            this.cronExpression = cronExpression;
            this.timezone = timezone;
            this.createdAt = createdAt;
        }

        RecurringTaskInfo toInfo() {
            return new RecurringTaskInfo(taskId, cronExpression, timezone, executing.get(), createdAt, lastExecution);
        }
    }
}
