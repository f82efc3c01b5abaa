package com.orderhub.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * 반복 작업 트리거와 일회성 작업 티커가 공유하는 스케줄러 설정.
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(SchedulingProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.recurringPoolSize());
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("스케줄 작업에서 처리되지 않은 예외가 발생했습니다.", t));
        return scheduler;
    }

    @Bean
    public Clock clock(SchedulingProperties properties) {
        return Clock.system(properties.timezone());
    }
}
