package com.orderhub.infrastructure.batch;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 배치 작업 메트릭.
 * <p>
 * 아이템 처리 결과와 작업 종료 상태를 Prometheus 메트릭으로 기록합니다.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class BatchJobMetrics {

    private final MeterRegistry meterRegistry;

    public void recordItems(String jobType, long succeeded, long failed) {
        if (succeeded > 0) {
            Counter.builder("batch.job.items")
                .description("배치 아이템 처리 건수")
                .tag("jobType", jobType)
                .tag("result", "success")
                .register(meterRegistry)
                .increment(succeeded);
        }
        if (failed > 0) {
            Counter.builder("batch.job.items")
                .description("배치 아이템 처리 건수")
                .tag("jobType", jobType)
                .tag("result", "failure")
                .register(meterRegistry)
                .increment(failed);
        }
    }

    /**
     * 아이템 재시도 횟수를 기록합니다.
     *
     * @param jobType 작업 유형
     */
    public void recordRetry(String jobType) {
        Counter.builder("batch.job.item.retry")
            .description("배치 아이템 재시도 횟수")
            .tag("jobType", jobType)
            .register(meterRegistry)
            .increment();
    }

    /**
     * 작업 종료를 기록합니다.
     *
     * @param jobType 작업 유형
     * @param status 종료 상태 (COMPLETED, FAILED, CANCELLED)
     * @param duration 소요 시간
     */
    public void recordJobFinished(String jobType, String status, Duration duration) {
        Timer.builder("batch.job.duration")
            .description("배치 작업 소요 시간")
            .tag("jobType", jobType)
            .tag("status", status)
            .register(meterRegistry)
            .record(duration);
    }
}
