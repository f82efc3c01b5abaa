package com.orderhub.application.scheduling;

import java.time.Instant;

/**
 * 예약된 일회성 작업 조회 결과.
 *
 * @param jobId 작업 ID
 * @param type 작업 종류 (항상 ONE_TIME)
 * @param executeTime 실행 예정 시각
 * @param createdAt 예약 시각
 */
public record OneTimeJob(String jobId, String type, Instant executeTime, Instant createdAt) {
    public static final String TYPE = "ONE_TIME";
}
