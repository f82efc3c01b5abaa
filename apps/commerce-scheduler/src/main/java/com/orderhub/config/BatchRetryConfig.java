package com.orderhub.config;

import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 배치 아이템 재시도 백오프 설정.
 * <p>
 * <b>Exponential Backoff 전략:</b>
 * <ul>
 *   <li><b>초기 대기 시간:</b> 1초</li>
 *   <li><b>배수(multiplier):</b> 2 (k번째 실패 후 2^(k-1)초 대기)</li>
 *   <li><b>jitter:</b> 없음</li>
 * </ul>
 * </p>
 * <p>
 * <b>재시도 시퀀스 예시 (retryAttempts = 3):</b>
 * <ol>
 *   <li>1차 시도: 즉시 실행</li>
 *   <li>2차 시도: 1초 후</li>
 *   <li>3차 시도: 2초 후</li>
 * </ol>
 * </p>
 */
@Slf4j
@Configuration
public class BatchRetryConfig {

    @Bean
    public IntervalFunction batchRetryIntervalFunction(SchedulingProperties properties) {
        SchedulingProperties.Retry retry = properties.retry();
        log.info("배치 아이템 재시도 백오프 설정: 초기 대기 {}ms, 배수 {}",
            retry.initialInterval().toMillis(), retry.multiplier());
        return IntervalFunction.ofExponentialBackoff(retry.initialInterval().toMillis(), retry.multiplier());
    }
}
