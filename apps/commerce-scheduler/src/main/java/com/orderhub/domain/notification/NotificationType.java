package com.orderhub.domain.notification;

/**
 * 알림 유형.
 */
public enum NotificationType {
    EVENT_STARTING,
    COUPON_EXPIRING,
    LOYALTY_POINTS_EXPIRING,
    LOYALTY_TIER_UPGRADE,
    LOYALTY_TIER_DOWNGRADE,
    LOYALTY_FESTIVAL_BONUS,
    DAILY_DIGEST,
    BULK_PUSH
}
