package com.orderhub.domain.event;

import java.util.List;

/**
 * 이벤트 도메인 서비스.
 */
public interface EventService {

    /**
     * 아직 시작하지 않은 이벤트를 조회합니다.
     */
    List<Event> getUpcomingEvents();

    /**
     * 진행 중인 이벤트를 조회합니다.
     */
    List<Event> getActiveEvents();

    void updateEventStatus(Long eventId, EventStatus status);
}
