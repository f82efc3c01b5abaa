package com.orderhub.infrastructure.commerceapi;

import com.orderhub.domain.coupon.Coupon;
import com.orderhub.domain.coupon.CouponService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 커머스 API를 호출하는 {@link CouponService} 구현체.
 */
@Component
@RequiredArgsConstructor
public class CouponServiceImpl implements CouponService {

    private final CouponApiClient couponApiClient;

    @Override
    public List<Coupon> getActiveCoupons() {
        List<CommerceApiDto.CouponResponse> responses =
            CommerceApiDto.unwrap(couponApiClient.getActiveCoupons(), "getActiveCoupons");
        if (responses == null) {
            return List.of();
        }
        return responses.stream()
            .map(CommerceApiDto.CouponResponse::toDomain)
            .toList();
    }

    @Override
    public List<Long> getCouponHolders(Long couponId) {
        CommerceApiDto.UserIdsResponse response =
            CommerceApiDto.unwrap(couponApiClient.getCouponHolders(couponId), "getCouponHolders");
        return response != null ? response.userIdsOrEmpty() : List.of();
    }
}
