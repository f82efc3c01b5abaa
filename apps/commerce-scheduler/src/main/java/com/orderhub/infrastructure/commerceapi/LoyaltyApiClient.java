package com.orderhub.infrastructure.commerceapi;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * 커머스 API 로열티 내부 엔드포인트 FeignClient.
 */
@FeignClient(
    name = "loyaltyApiClient",
    url = "${commerce-api.url}",
    path = "/internal/v1/loyalty"
)
public interface LoyaltyApiClient {

    @GetMapping("/points/expiring")
    CommerceApiDto.ApiResponse<List<CommerceApiDto.ExpiringPointsResponse>> getExpiringPoints(
        @RequestParam("withinDays") int withinDays
    );

    @PostMapping("/points/expire")
    CommerceApiDto.ApiResponse<CommerceApiDto.PointExpiryResponse> processExpiredPoints();

    @GetMapping("/members/count")
    CommerceApiDto.ApiResponse<CommerceApiDto.CountResponse> countMembers();

    @GetMapping("/members")
    CommerceApiDto.ApiResponse<CommerceApiDto.UserIdsResponse> getMemberIds(
        @RequestParam("offset") long offset,
        @RequestParam("limit") int limit
    );

    @PostMapping("/members/{userId}/tier-evaluation")
    CommerceApiDto.ApiResponse<CommerceApiDto.TierEvaluationResponse> evaluateTier(@PathVariable("userId") Long userId);

    @PostMapping("/members/{userId}/festival-bonus")
    CommerceApiDto.ApiResponse<CommerceApiDto.FestivalBonusResponse> grantFestivalBonus(
        @PathVariable("userId") Long userId,
        @RequestBody CommerceApiDto.FestivalBonusRequest request
    );
}
