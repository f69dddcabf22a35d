package personal.eventhub.core.registration.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Registration
 */
public interface JpaRegistrationRepository extends JpaRepository<RegistrationEntity, Long> {

    boolean existsByUserIdAndEventId(Long userId, Long eventId);

    Optional<RegistrationEntity> findByUserIdAndEventId(Long userId, Long eventId);

    boolean existsByUserId(Long userId);

    long countByEventId(Long eventId);

    /**
     * ID로 삭제하고 삭제된 행 수 반환
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RegistrationEntity r WHERE r.id = :id")
    int deleteByIdReturningCount(@Param("id") Long id);
}
