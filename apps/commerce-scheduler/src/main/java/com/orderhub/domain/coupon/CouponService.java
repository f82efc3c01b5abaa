package com.orderhub.domain.coupon;

import java.util.List;

/**
 * 쿠폰 도메인 서비스.
 */
public interface CouponService {

    List<Coupon> getActiveCoupons();

    /**
     * 쿠폰을 보유한 사용자 ID 목록을 조회합니다.
     *
     * @param couponId 쿠폰 ID
     * @return 사용자 ID 목록
     */
    List<Long> getCouponHolders(Long couponId);
}
