package com.orderhub.application.scheduling;

import java.time.Instant;
import java.time.ZoneId;

/**
 * 등록된 반복 작업 조회 결과.
 *
 * @param taskId 작업 ID
 * @param cronExpression cron 표현식 (초 단위 포함 6필드)
 * @param timezone cron 해석 시간대
 * @param executing 현재 실행 중인지 여부
 * @param createdAt 등록 시각
 * @param lastExecution 마지막 실행 기록 (실행 전에는 null)
 */
public record RecurringTaskInfo(
    String taskId,
    String cronExpression,
    ZoneId timezone,
    boolean executing,
    Instant createdAt,
    TaskExecution lastExecution
) {

    /**
     * 반복 작업 한 번의 실행 기록.
     *
     * @param executionId 실행 ID ({@code {taskId}_{epochMillis}})
     * @param status SUCCESS 또는 FAILED
     * @param executedAt 실행 시작 시각
     * @param durationMillis 소요 시간
     * @param errorMessage 실패 메시지
     */
    public record TaskExecution(
        String executionId,
        String status,
        Instant executedAt,
        long durationMillis,
        String errorMessage
    ) {
        public static final String SUCCESS = "SUCCESS";
        public static final String FAILED = "FAILED";
    }
}
