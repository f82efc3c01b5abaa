package com.orderhub.domain.event;

/**
 * 이벤트 진행 상태.
 */
public enum EventStatus {
    SCHEDULED,
    ACTIVE,
    ENDED
}
