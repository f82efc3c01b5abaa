package com.orderhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 스케줄링/배치 엔진 설정.
 *
 * @param timezone 반복 작업 cron 표현식을 해석할 시간대
 * @param oneTimePollInterval 일회성 작업 만료 여부를 확인하는 주기
 * @param snapshotTtl 배치 작업 스냅샷 보관 기간 (마지막 쓰기 기준)
 * @param workerPoolSize 배치 페이지 조회와 아이템 처리를 수행하는 스레드 수
 * @param recurringPoolSize 반복 작업 트리거 스레드 수
 * @param recurringEnabled 기본 반복 작업 등록 여부
 * @param retry 아이템 재시도 백오프 설정
 */
@ConfigurationProperties("scheduling")
public record SchedulingProperties(
    ZoneId timezone,
    Duration oneTimePollInterval,
    Duration snapshotTtl,
    Integer workerPoolSize,
    Integer recurringPoolSize,
    Boolean recurringEnabled,
    Retry retry
) {
    public static final ZoneId DEFAULT_TIMEZONE = ZoneId.of("Asia/Ho_Chi_Minh");

    public SchedulingProperties {
        timezone = timezone != null ? timezone : DEFAULT_TIMEZONE;
        oneTimePollInterval = oneTimePollInterval != null ? oneTimePollInterval : Duration.ofSeconds(1);
        snapshotTtl = snapshotTtl != null ? snapshotTtl : Duration.ofHours(24);
        workerPoolSize = workerPoolSize != null ? workerPoolSize : 16;
        recurringPoolSize = recurringPoolSize != null ? recurringPoolSize : 4;
        recurringEnabled = recurringEnabled != null ? recurringEnabled : Boolean.TRUE;
        retry = retry != null ? retry : new Retry(null, null);
    }

    /**
     * @param initialInterval 첫 번째 재시도 전 대기 시간
     * @param multiplier 재시도마다 곱해지는 배수
     */
    public record Retry(Duration initialInterval, Double multiplier) {
        public Retry {
            initialInterval = initialInterval != null ? initialInterval : Duration.ofSeconds(1);
            multiplier = multiplier != null ? multiplier : 2.0;
        }
    }

    public static SchedulingProperties defaults() {
        return new SchedulingProperties(null, null, null, null, null, null, null);
    }
}
