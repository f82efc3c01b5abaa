package com.orderhub.domain.event;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * 프로모션 이벤트.
 *
 * @param id 이벤트 ID
 * @param name 이벤트 이름
 * @param startTime 시작 시각
 * @param endTime 종료 시각
 * @param status 현재 상태
 * @param targetAudience 알림 대상 (없으면 전체)
 */
public record Event(
    Long id,
    String name,
    ZonedDateTime startTime,
    ZonedDateTime endTime,
    EventStatus status,
    String targetAudience
) {
    public static final String ALL_AUDIENCE = "ALL";

    public String targetAudienceOrAll() {
        return targetAudience != null && !targetAudience.isBlank() ? targetAudience : ALL_AUDIENCE;
    }

    /**
     * 주어진 시각에 있어야 할 상태를 계산합니다.
     *
     * @param now 기준 시각
     * @return 종료 시각 이후면 ENDED, 시작 시각 이후면 ACTIVE, 그 외에는 SCHEDULED
     */
    public EventStatus expectedStatusAt(Instant now) {
        if (endTime != null && !now.isBefore(endTime.toInstant())) {
            return EventStatus.ENDED;
        }
        if (startTime != null && !now.isBefore(startTime.toInstant())) {
            return EventStatus.ACTIVE;
        }
        return EventStatus.SCHEDULED;
    }
}
