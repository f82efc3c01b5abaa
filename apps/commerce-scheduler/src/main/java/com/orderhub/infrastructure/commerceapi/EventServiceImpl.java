package com.orderhub.infrastructure.commerceapi;

import com.orderhub.domain.event.Event;
import com.orderhub.domain.event.EventService;
import com.orderhub.domain.event.EventStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 커머스 API를 호출하는 {@link EventService} 구현체.
 */
@Component
@RequiredArgsConstructor
public class EventServiceImpl implements EventService {

    private final EventApiClient eventApiClient;

    @Override
    public List<Event> getUpcomingEvents() {
        return toEvents(CommerceApiDto.unwrap(eventApiClient.getUpcomingEvents(), "getUpcomingEvents"));
    }

    @Override
    public List<Event> getActiveEvents() {
        return toEvents(CommerceApiDto.unwrap(eventApiClient.getActiveEvents(), "getActiveEvents"));
    }

    @Override
    public void updateEventStatus(Long eventId, EventStatus status) {
        CommerceApiDto.unwrap(
            eventApiClient.updateEventStatus(eventId, new CommerceApiDto.EventStatusRequest(status)),
            "updateEventStatus"
        );
    }

    private List<Event> toEvents(List<CommerceApiDto.EventResponse> responses) {
        if (responses == null) {
            return List.of();
        }
        return responses.stream()
            .map(CommerceApiDto.EventResponse::toDomain)
            .toList();
    }
}
