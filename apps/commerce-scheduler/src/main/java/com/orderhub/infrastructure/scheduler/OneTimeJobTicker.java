package com.orderhub.infrastructure.scheduler;

import com.orderhub.application.scheduling.OneTimeJobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 일회성 작업 큐를 주기적으로 확인하는 스케줄러.
 * <p>
 * {@code scheduling.one-time-poll-interval} 간격(기본 1초)으로 실행 시각이 지난 작업을 실행합니다.
 * 따라서 실제 실행은 예약 시각보다 최대 한 주기만큼 늦을 수 있습니다.
 * 작업 본문은 {@code oneTimeJobExecutor}에서 실행되므로 티커는 반복 작업과 공유하는 스케줄러 스레드를 오래 점유하지 않습니다.
 * </p>
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class OneTimeJobTicker {

    private final OneTimeJobScheduler oneTimeJobScheduler;

    @Scheduled(fixedDelayString = "${scheduling.one-time-poll-interval:PT1S}")
    public void tick() {
        try {
            int fired = oneTimeJobScheduler.runDueJobs();
            if (fired > 0) {
                log.debug("일회성 작업 실행. (fired: {})", fired);
            }
        } catch (Exception e) {
            log.warn("일회성 작업 큐 확인 중 오류 발생.", e);
        }
    }
}
