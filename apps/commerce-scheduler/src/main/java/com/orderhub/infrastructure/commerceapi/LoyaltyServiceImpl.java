package com.orderhub.infrastructure.commerceapi;

import com.orderhub.domain.loyalty.ExpiringPoints;
import com.orderhub.domain.loyalty.LoyaltyService;
import com.orderhub.domain.loyalty.PointExpiryResult;
import com.orderhub.domain.loyalty.TierChange;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 커머스 API를 호출하는 {@link LoyaltyService} 구현체.
 */
@Component
@RequiredArgsConstructor
public class LoyaltyServiceImpl implements LoyaltyService {

    private final LoyaltyApiClient loyaltyApiClient;

    @Override
    public List<ExpiringPoints> getExpiringPoints(int withinDays) {
        List<CommerceApiDto.ExpiringPointsResponse> responses =
            CommerceApiDto.unwrap(loyaltyApiClient.getExpiringPoints(withinDays), "getExpiringPoints");
        if (responses == null) {
            return List.of();
        }
        return responses.stream()
            .map(CommerceApiDto.ExpiringPointsResponse::toDomain)
            .toList();
    }

    @Override
    public PointExpiryResult processExpiredPoints() {
        CommerceApiDto.PointExpiryResponse response =
            CommerceApiDto.unwrap(loyaltyApiClient.processExpiredPoints(), "processExpiredPoints");
        return response != null ? response.toDomain() : new PointExpiryResult(0L, 0L);
    }

    @Override
    public long countMembers() {
        CommerceApiDto.CountResponse response = CommerceApiDto.unwrap(loyaltyApiClient.countMembers(), "countMembers");
        return response != null ? response.count() : 0L;
    }

    @Override
    public List<Long> getMemberIds(long offset, int limit) {
        CommerceApiDto.UserIdsResponse response =
            CommerceApiDto.unwrap(loyaltyApiClient.getMemberIds(offset, limit), "getMemberIds");
        return response != null ? response.userIdsOrEmpty() : List.of();
    }

    @Override
    public Optional<TierChange> evaluateTier(Long userId) {
        CommerceApiDto.TierEvaluationResponse response =
            CommerceApiDto.unwrap(loyaltyApiClient.evaluateTier(userId), "evaluateTier");
        if (response == null || !response.changed()) {
            return Optional.empty();
        }
        return Optional.of(response.toDomain());
    }

    @Override
    public long grantFestivalBonus(Long userId, String festivalType, double multiplier) {
        CommerceApiDto.FestivalBonusResponse response = CommerceApiDto.unwrap(
            loyaltyApiClient.grantFestivalBonus(userId, new CommerceApiDto.FestivalBonusRequest(festivalType, multiplier)),
            "grantFestivalBonus"
        );
        return response != null ? response.grantedPoints() : 0L;
    }
}
