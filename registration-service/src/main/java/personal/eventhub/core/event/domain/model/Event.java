package personal.eventhub.core.event.domain.model;

import personal.eventhub.common.exception.BusinessException;
import personal.eventhub.common.exception.ErrorCode;

/**
 * Event Domain Model (Seat Ledger 스냅샷)
 * 정원(capacity)과 잔여 좌석(availableSeats)을 보유하는 불변 모델
 * 잔여 좌석은 SeatLedger의 reserve/release 로만 변경된다
 */
public record Event(
        Long id,
        String title,
        int capacity,
        int availableSeats,
        Long organizerId
) {
    public Event {
        if (title == null || title.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event title cannot be null or blank");
        }
        if (capacity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event capacity must be positive");
        }
        if (availableSeats < 0 || availableSeats > capacity) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Available seats out of range: availableSeats=%d, capacity=%d", availableSeats, capacity));
        }
        if (organizerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Organizer ID cannot be null");
        }
    }

    /**
     * 이벤트 생성 (잔여 좌석 = 정원)
     */
    public static Event create(String title, int capacity, Long organizerId) {
        return new Event(null, title, capacity, capacity, organizerId);
    }

    /**
     * 제목 변경 (좌석 정보는 유지)
     */
    public Event rename(String newTitle) {
        return new Event(id, newTitle, capacity, availableSeats, organizerId);
    }

    public boolean hasAvailableSeats() {
        return availableSeats > 0;
    }

    /**
     * 현재 점유된 좌석 수
     */
    public int reservedSeats() {
        return capacity - availableSeats;
    }
}
