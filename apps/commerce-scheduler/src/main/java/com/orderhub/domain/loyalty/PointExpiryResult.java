package com.orderhub.domain.loyalty;

/**
 * 포인트 만료 처리 결과.
 *
 * @param expiredUsers 포인트가 만료된 사용자 수
 * @param totalExpiredPoints 만료된 포인트 합계
 */
public record PointExpiryResult(long expiredUsers, long totalExpiredPoints) {
}
