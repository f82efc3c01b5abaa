package com.orderhub.application.scheduling;

import com.orderhub.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 절대 시각에 한 번 실행되는 작업의 레지스트리.
 * <p>
 * 실행 시각 기준 최소 힙에 작업을 보관하고, {@link #runDueJobs()}가 호출될 때 실행 시각이 지난 작업을 꺼내 실행합니다.
 * 운영 환경에서는 {@code OneTimeJobTicker}가 주기적으로 호출합니다.
 * </p>
 * <p>
 * <b>동작 규칙:</b>
 * <ul>
 *   <li>현재 시각 이전이나 같은 시각으로는 예약할 수 없습니다.</li>
 *   <li>같은 ID로 다시 예약하면 조회/취소 대상은 새 예약으로 바뀌지만 이전 예약도 예정대로 실행됩니다.</li>
 *   <li>작업 예외는 로그로만 남기며 다른 작업 실행에 영향을 주지 않습니다.</li>
 *   <li>만료된 작업은 {@code jobExecutor}에 넘겨 실행하므로 오래 걸리는 작업이 다음 작업의 실행을 늦추지 않습니다.</li>
 * </ul>
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@Component
public class OneTimeJobScheduler {

    private final Clock clock;
    private final Executor jobExecutor;
    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<OneTimeJobEntry> queue = new PriorityQueue<>(
        Comparator.comparing(OneTimeJobEntry::getExecuteTime).thenComparingLong(OneTimeJobEntry::getSequence)
    );
    private final Map<String, OneTimeJobEntry> entries = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * 만료된 작업을 호출 스레드에서 바로 실행하는 스케줄러를 생성합니다.
     */
    public OneTimeJobScheduler(Clock clock) {
        this(clock, Runnable::run);
    }

    @Autowired
    public OneTimeJobScheduler(Clock clock, @Qualifier(AsyncConfig.ONE_TIME_JOB_EXECUTOR) Executor jobExecutor) {
        this.clock = clock;
        this.jobExecutor = jobExecutor;
    }

    /**
     * 작업을 예약합니다.
     *
     * @param jobId 작업 ID
     * @param executeTime 실행 시각
     * @param task 실행할 작업
     * @return 예약 여부 (실행 시각이 현재 이후가 아니면 false)
     */
    public boolean schedule(String jobId, Instant executeTime, Runnable task) {
        Instant now = clock.instant();
        if (!executeTime.isAfter(now)) {
            log.warn("과거 시각으로는 일회성 작업을 예약할 수 없습니다. (jobId: {}, executeTime: {}, now: {})",
                jobId, executeTime, now);
            return false;
        }

        OneTimeJobEntry entry = new OneTimeJobEntry(jobId, executeTime, now, sequence.incrementAndGet(), task);
        OneTimeJobEntry previous;
        lock.lock();
        try {
            previous = entries.put(jobId, entry);
            queue.add(entry);
        } finally {
            lock.unlock();
        }
        if (previous != null) {
            log.warn("같은 ID의 일회성 작업이 이미 예약되어 있습니다. 이전 예약도 예정대로 실행됩니다. (jobId: {})", jobId);
        }
        log.info("일회성 작업 예약 완료. (jobId: {}, executeTime: {})", jobId, executeTime);
        return true;
    }

    /**
     * 실행 시각이 지난 작업을 모두 실행합니다.
     *
     * @return 실행한 작업 수
     */
    public int runDueJobs() {
        Instant now = clock.instant();
        List<OneTimeJobEntry> due = new ArrayList<>();
        lock.lock();
        try {
            while (!queue.isEmpty() && !queue.peek().getExecuteTime().isAfter(now)) {
                OneTimeJobEntry entry = queue.poll();
                entries.remove(entry.getJobId(), entry);
                if (entry.isPending()) {
                    due.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }

        int fired = 0;
        for (OneTimeJobEntry entry : due) {
            if (fire(entry)) {
                fired++;
            }
        }
        return fired;
    }

    /**
     * 예약을 취소합니다.
     *
     * @param jobId 작업 ID
     * @return 취소 여부 (예약이 없으면 false)
     */
    public boolean cancel(String jobId) {
        OneTimeJobEntry entry;
        lock.lock();
        try {
            entry = entries.remove(jobId);
            if (entry == null) {
                return false;
            }
            queue.remove(entry);
        } finally {
            lock.unlock();
        }
        boolean cancelled = entry.cancel();
        if (cancelled) {
            log.info("일회성 작업 취소. (jobId: {})", jobId);
        }
        return cancelled;
    }

    /**
     * 예약된 작업을 모두 취소합니다.
     *
     * @return 취소한 작업 수
     */
    public int cancelAll() {
        List<OneTimeJobEntry> pending;
        lock.lock();
        try {
            pending = new ArrayList<>(queue);
            queue.clear();
            entries.clear();
        } finally {
            lock.unlock();
        }
        int cancelled = 0;
        for (OneTimeJobEntry entry : pending) {
            if (entry.cancel()) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("일회성 작업 {}개를 모두 취소했습니다.", cancelled);
        }
        return cancelled;
    }

    public List<OneTimeJob> getJobs() {
        lock.lock();
        try {
            return entries.values().stream()
                .sorted(Comparator.comparing(OneTimeJobEntry::getExecuteTime))
                .map(OneTimeJobEntry::toView)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> nextExecuteTime() {
        lock.lock();
        try {
            return Optional.ofNullable(queue.peek()).map(OneTimeJobEntry::getExecuteTime);
        } finally {
            lock.unlock();
        }
    }

    private boolean fire(OneTimeJobEntry entry) {
        if (!entry.markFired()) {
            return false;
        }
        log.info("일회성 작업 실행. (jobId: {})", entry.getJobId());
        try {
            jobExecutor.execute(() -> runTask(entry));
        } catch (RejectedExecutionException e) {
            log.error("일회성 작업 실행 요청이 거절되었습니다. (jobId: {})", entry.getJobId(), e);
        }
        return true;
    }

    private void runTask(OneTimeJobEntry entry) {
        try {
            entry.getTask().run();
        } catch (Exception e) {
            log.error("일회성 작업 실행 실패. (jobId: {})", entry.getJobId(), e);
        }
    }
}
