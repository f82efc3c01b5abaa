package com.orderhub.infrastructure.commerceapi;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.util.List;

/**
 * 커머스 API 쿠폰 내부 엔드포인트 FeignClient.
 */
@FeignClient(
    name = "couponApiClient",
    url = "${commerce-api.url}",
    path = "/internal/v1/coupons"
)
public interface CouponApiClient {

    @GetMapping("/active")
    CommerceApiDto.ApiResponse<List<CommerceApiDto.CouponResponse>> getActiveCoupons();

    @GetMapping("/{couponId}/holders")
    CommerceApiDto.ApiResponse<CommerceApiDto.UserIdsResponse> getCouponHolders(@PathVariable("couponId") Long couponId);
}
