package personal.eventhub.core.event.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.eventhub.common.dto.ApiResponse;
import personal.eventhub.core.event.adapter.in.web.dto.CreateEventRequest;
import personal.eventhub.core.event.adapter.in.web.dto.EventResponse;
import personal.eventhub.core.event.adapter.in.web.dto.UpdateEventRequest;
import personal.eventhub.core.event.application.port.in.GetEventUseCase;
import personal.eventhub.core.event.application.port.in.ManageEventUseCase;
import personal.eventhub.core.event.domain.model.Event;

/**
 * Event API Controller
 * 이벤트 생성/조회/수정/삭제 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class EventController {

    private final GetEventUseCase getEventUseCase;
    private final ManageEventUseCase manageEventUseCase;

    /**
     * 이벤트 생성
     * POST /api/v1/events
     */
    @PostMapping
    public ResponseEntity<EventResponse> createEvent(@Valid @RequestBody CreateEventRequest request) {
        log.info("Create event: organizerId={}, capacity={}", request.organizerId(), request.capacity());

        Event event = manageEventUseCase.createEvent(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.from(event));
    }

    /**
     * 이벤트 조회
     * GET /api/v1/events/{eventId}
     */
    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable Long eventId) {
        log.info("Get event: eventId={}", eventId);
        return ResponseEntity.ok(EventResponse.from(getEventUseCase.getEvent(eventId)));
    }

    /**
     * 이벤트 수정 (제목)
     * PUT /api/v1/events/{eventId}
     */
    @PutMapping("/{eventId}")
    public ResponseEntity<EventResponse> updateEvent(
            @PathVariable Long eventId,
            @Valid @RequestBody UpdateEventRequest request
    ) {
        log.info("Update event: eventId={}", eventId);

        Event event = manageEventUseCase.updateEvent(request.toCommand(eventId));

        return ResponseEntity.ok(EventResponse.from(event));
    }

    /**
     * 이벤트 삭제
     * DELETE /api/v1/events/{eventId}
     */
    @DeleteMapping("/{eventId}")
    public ResponseEntity<ApiResponse<Void>> deleteEvent(@PathVariable Long eventId) {
        log.info("Delete event: eventId={}", eventId);

        manageEventUseCase.deleteEvent(eventId);

        return ResponseEntity.ok(ApiResponse.success("Event deleted successfully"));
    }
}
