package com.orderhub.domain.coupon;

import java.time.ZonedDateTime;

/**
 * 발급된 쿠폰 정의.
 *
 * @param id 쿠폰 ID
 * @param code 쿠폰 코드
 * @param discountValue 할인 값
 * @param expiresAt 만료 시각
 */
public record Coupon(
    Long id,
    String code,
    Long discountValue,
    ZonedDateTime expiresAt
) {
}
