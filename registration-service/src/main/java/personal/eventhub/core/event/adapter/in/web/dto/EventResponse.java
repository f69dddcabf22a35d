package personal.eventhub.core.event.adapter.in.web.dto;

import personal.eventhub.core.event.domain.model.Event;

/**
 * 이벤트 응답 DTO
 */
public record EventResponse(
        Long id,
        String title,
        int capacity,
        int availableSeats,
        Long organizerId
) {
    public static EventResponse from(Event event) {
        return new EventResponse(
                event.id(),
                event.title(),
                event.capacity(),
                event.availableSeats(),
                event.organizerId()
        );
    }
}
