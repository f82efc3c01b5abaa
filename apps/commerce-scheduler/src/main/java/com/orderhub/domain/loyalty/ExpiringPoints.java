package com.orderhub.domain.loyalty;

import java.time.ZonedDateTime;

/**
 * 만료 예정 포인트.
 *
 * @param userId 사용자 ID
 * @param points 만료 예정 포인트
 * @param expiresAt 만료 시각
 */
public record ExpiringPoints(Long userId, long points, ZonedDateTime expiresAt) {
}
