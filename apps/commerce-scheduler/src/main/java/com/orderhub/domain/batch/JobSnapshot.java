package com.orderhub.domain.batch;

import java.time.Instant;

/**
 * 배치 작업의 특정 시점 상태.
 * <p>
 * 진행 중인 작업 조회 결과이자 저장소에 기록되는 레코드입니다.
 * </p>
 *
 * @param jobId 작업 ID
 * @param jobType 작업 유형
 * @param status 상태
 * @param totalItems 전체 아이템 수
 * @param processedItems 처리 성공 아이템 수
 * @param failedItems 재시도 소진 후 실패한 아이템 수
 * @param progress 진행률 (0~100)
 * @param startTime 시작 시각
 * @param endTime 종료 시각 (종료 전에는 null)
 * @param durationMillis 소요 시간 (종료 전에는 null)
 * @param error 실패 메시지 (FAILED 상태에서만 존재)
 * @param updatedAt 스냅샷 생성 시각
 */
public record JobSnapshot(
    String jobId,
    String jobType,
    JobStatus status,
    long totalItems,
    long processedItems,
    long failedItems,
    int progress,
    Instant startTime,
    Instant endTime,
    Long durationMillis,
    String error,
    Instant updatedAt
) {
}
