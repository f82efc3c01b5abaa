package com.orderhub.infrastructure.scheduler;

import com.orderhub.application.scheduling.SchedulingManager;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 기동/종료 시점에 스케줄링 매니저를 초기화하고 정리합니다.
 *
 * @author orderhub
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SchedulingBootstrap {

    private final SchedulingManager schedulingManager;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        schedulingManager.initialize();
    }

    @PreDestroy
    public void onShutdown() {
        log.info("애플리케이션 종료로 스케줄링을 정리합니다.");
        schedulingManager.shutdown();
    }
}
