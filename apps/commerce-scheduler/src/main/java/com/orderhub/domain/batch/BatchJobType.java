package com.orderhub.domain.batch;

import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;

/**
 * 즉시 실행 및 반복 실행이 가능한 배치 작업 유형.
 */
public enum BatchJobType {
    LOYALTY_POINTS_EXPIRY,
    LOYALTY_TIER_EVALUATION,
    LOYALTY_FESTIVAL_BONUS,
    NOTIFICATION_DAILY_DIGEST,
    NOTIFICATION_BULK_PUSH,
    NOTIFICATION_CLEANUP,
    EVENT_STATUS_SYNC;

    /**
     * 문자열 유형 이름을 변환합니다.
     *
     * @param value 유형 이름 (대소문자 구분 없음)
     * @return 배치 작업 유형
     * @throws CoreException 지원하지 않는 유형인 경우 (BAD_REQUEST)
     */
    public static BatchJobType from(String value) {
        if (value == null || value.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "배치 작업 유형은 필수입니다.");
        }
        try {
            return BatchJobType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("지원하지 않는 배치 작업 유형입니다. (유형: %s)", value));
        }
    }

    /**
     * 실행마다 고유한 작업 ID를 생성합니다.
     *
     * @param epochMillis 실행 시각
     * @return {@code {유형 소문자}_{epochMillis}}
     */
    public String newJobId(long epochMillis) {
        return name().toLowerCase() + "_" + epochMillis;
    }
}
