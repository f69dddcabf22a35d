package personal.eventhub.core.user.application.port.out;

/**
 * User Registration Port
 * 사용자 삭제 전 등록 내역 확인 (registration 컨텍스트 위임)
 */
public interface UserRegistrationPort {

    boolean hasRegistrations(Long userId);
}
