package personal.eventhub.core.event.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Event
 */
public interface JpaEventRepository extends JpaRepository<EventEntity, Long> {

    /**
     * 비관적 쓰기 락으로 조회 (SELECT ... FOR UPDATE)
     * 락 대기 시간 제한 힌트 적용 (DB가 지원하는 경우)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT e FROM EventEntity e WHERE e.id = :id")
    Optional<EventEntity> findByIdForUpdate(@Param("id") Long id);

    /**
     * 조건부 좌석 차감
     *
     * @return 변경된 행 수 (0 = 잔여 좌석 없음 또는 이벤트 없음)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE EventEntity e SET e.availableSeats = e.availableSeats - 1, e.updatedAt = :now " +
            "WHERE e.id = :id AND e.availableSeats > 0")
    int decreaseAvailableSeats(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * 좌석 반환
     *
     * @return 변경된 행 수
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE EventEntity e SET e.availableSeats = e.availableSeats + 1, e.updatedAt = :now " +
            "WHERE e.id = :id")
    int increaseAvailableSeats(@Param("id") Long id, @Param("now") LocalDateTime now);
}
