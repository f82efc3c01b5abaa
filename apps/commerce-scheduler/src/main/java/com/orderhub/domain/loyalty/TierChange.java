package com.orderhub.domain.loyalty;

/**
 * 등급 재평가로 발생한 등급 변경.
 *
 * @param userId 사용자 ID
 * @param previousTier 이전 등급
 * @param newTier 새 등급
 * @param upgrade 상향 여부 (false면 하향)
 */
public record TierChange(Long userId, String previousTier, String newTier, boolean upgrade) {
}
