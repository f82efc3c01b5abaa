package com.orderhub.domain.loyalty;

import java.util.List;
import java.util.Optional;

/**
 * 로열티 도메인 서비스.
 */
public interface LoyaltyService {

    /**
     * 지정한 일수 안에 만료되는 포인트를 조회합니다.
     *
     * @param withinDays 조회 기간 (일)
     * @return 사용자별 만료 예정 포인트
     */
    List<ExpiringPoints> getExpiringPoints(int withinDays);

    PointExpiryResult processExpiredPoints();

    long countMembers();

    List<Long> getMemberIds(long offset, int limit);

    /**
     * 사용자의 등급을 재평가합니다.
     *
     * @param userId 사용자 ID
     * @return 등급이 바뀐 경우 변경 내역
     */
    Optional<TierChange> evaluateTier(Long userId);

    /**
     * 축제 보너스 포인트를 지급합니다.
     *
     * @return 지급된 포인트
     */
    long grantFestivalBonus(Long userId, String festivalType, double multiplier);
}
