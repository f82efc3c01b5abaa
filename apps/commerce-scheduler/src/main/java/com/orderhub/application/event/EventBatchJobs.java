package com.orderhub.application.event;

import com.orderhub.application.batch.BatchProcessor;
import com.orderhub.domain.batch.BatchJobType;
import com.orderhub.domain.batch.JobConfig;
import com.orderhub.domain.batch.JobSnapshot;
import com.orderhub.domain.event.Event;
import com.orderhub.domain.event.EventService;
import com.orderhub.domain.event.EventStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 이벤트 상태 동기화 배치 작업.
 * <p>
 * 예정/진행 중 이벤트의 상태를 현재 시각 기준으로 맞춥니다.
 * 일회성 종료 작업이 누락된 경우(재시작 등)에도 매시간 상태가 보정됩니다.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventBatchJobs {

    private final BatchProcessor batchProcessor;
    private final EventService eventService;
    private final Clock clock;

    public JobSnapshot syncEventStatuses() {
        BatchJobType type = BatchJobType.EVENT_STATUS_SYNC;
        List<Event> events = new ArrayList<>(eventService.getUpcomingEvents());
        events.addAll(eventService.getActiveEvents());
        AtomicLong started = new AtomicLong();
        AtomicLong ended = new AtomicLong();

        JobSnapshot snapshot = batchProcessor.executeBatchJob(JobConfig.<Event>builder()
            .jobId(type.newJobId(clock.millis()))
            .jobType(type.name())
            .items(events)
            .processor(event -> {
                Instant now = clock.instant();
                EventStatus expected = event.expectedStatusAt(now);
                if (expected != event.status()) {
                    eventService.updateEventStatus(event.id(), expected);
                    if (expected == EventStatus.ACTIVE) {
                        started.incrementAndGet();
                    } else if (expected == EventStatus.ENDED) {
                        ended.incrementAndGet();
                    }
                }
                return event;
            })
            .build());

        log.info("[이벤트 상태 동기화] 시작 {}개, 종료 {}개", started.get(), ended.get());
        return snapshot;
    }
}
