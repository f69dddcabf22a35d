package personal.eventhub.core.user.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.eventhub.core.user.application.port.in.CreateUserCommand;
import personal.eventhub.core.user.application.port.in.UpdateUserCommand;
import personal.eventhub.core.user.application.port.out.UserRegistrationPort;
import personal.eventhub.core.user.application.port.out.UserRepository;
import personal.eventhub.core.user.domain.exception.UserAlreadyExistsException;
import personal.eventhub.core.user.domain.exception.UserHasRegistrationsException;
import personal.eventhub.core.user.domain.exception.UserNotFoundException;
import personal.eventhub.core.user.domain.model.User;
import personal.eventhub.core.user.domain.model.UserRole;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService 단위 테스트")
class UserServiceTest {

    private static final Long TEST_USER_ID = 1L;
    private static final String TEST_EMAIL = "test@example.com";
    @Mock
    private UserRepository userRepository;
    @Mock
    private UserRegistrationPort userRegistrationPort;
    @InjectMocks
    private UserService userService;
    private User testUser;

    @BeforeEach
    void setUp() {
        testUser = new User(TEST_USER_ID, "Test User", TEST_EMAIL, UserRole.ATTENDEE);
    }

    @Test
    @DisplayName("사용자 검증 성공 - 사용자 존재")
    void validateUser_Success() {
        // given
        given(userRepository.findById(TEST_USER_ID)).willReturn(Optional.of(testUser));

        // when
        User result = userService.validateUser(TEST_USER_ID);

        // then
        assertThat(result.id()).isEqualTo(TEST_USER_ID);
        assertThat(result.email()).isEqualTo(TEST_EMAIL);
        verify(userRepository).findById(TEST_USER_ID);
    }

    @Test
    @DisplayName("사용자 검증 실패 - 사용자 없음")
    void validateUser_UserNotFound() {
        // given
        given(userRepository.findById(TEST_USER_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> userService.validateUser(TEST_USER_ID))
                .isInstanceOf(UserNotFoundException.class)
                .hasMessageContaining("User not found")
                .hasMessageContaining(String.valueOf(TEST_USER_ID));
    }

    @Test
    @DisplayName("사용자 존재 여부 확인")
    void exists() {
        // given
        given(userRepository.existsById(TEST_USER_ID)).willReturn(true);
        given(userRepository.existsById(2L)).willReturn(false);

        // when & then
        assertThat(userService.exists(TEST_USER_ID)).isTrue();
        assertThat(userService.exists(2L)).isFalse();
    }

    @Test
    @DisplayName("이메일로 사용자 조회 실패 - 사용자 없음")
    void getUserByEmail_NotFound() {
        // given
        given(userRepository.findByEmail("nobody@example.com")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> userService.getUserByEmail("nobody@example.com"))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("사용자 생성 성공 - 역할 미지정 시 ATTENDEE")
    void createUser_Success() {
        // given
        given(userRepository.existsByEmail(TEST_EMAIL)).willReturn(false);
        given(userRepository.save(any(User.class)))
                .willAnswer(invocation -> {
                    User user = invocation.getArgument(0);
                    return new User(TEST_USER_ID, user.name(), user.email(), user.role());
                });

        // when
        User result = userService.createUser(new CreateUserCommand("Test User", TEST_EMAIL, null));

        // then
        assertThat(result.id()).isEqualTo(TEST_USER_ID);
        assertThat(result.role()).isEqualTo(UserRole.ATTENDEE);
    }

    @Test
    @DisplayName("사용자 생성 실패 - 이메일 중복")
    void createUser_DuplicateEmail() {
        // given
        given(userRepository.existsByEmail(TEST_EMAIL)).willReturn(true);

        // when & then
        assertThatThrownBy(() -> userService.createUser(new CreateUserCommand("Other", TEST_EMAIL, UserRole.ORGANIZER)))
                .isInstanceOf(UserAlreadyExistsException.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("사용자 수정 - 역할이 없으면 기존 역할 유지")
    void updateUser_KeepsRole() {
        // given
        User organizer = new User(TEST_USER_ID, "Organizer", TEST_EMAIL, UserRole.ORGANIZER);
        given(userRepository.findById(TEST_USER_ID)).willReturn(Optional.of(organizer));
        given(userRepository.save(any(User.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        User result = userService.updateUser(new UpdateUserCommand(TEST_USER_ID, "Renamed", TEST_EMAIL, null));

        // then
        assertThat(result.name()).isEqualTo("Renamed");
        assertThat(result.role()).isEqualTo(UserRole.ORGANIZER);
        verify(userRepository, never()).existsByEmail(any());
    }

    @Test
    @DisplayName("사용자 수정 실패 - 다른 사용자의 이메일")
    void updateUser_EmailTaken() {
        // given
        given(userRepository.findById(TEST_USER_ID)).willReturn(Optional.of(testUser));
        given(userRepository.existsByEmail("taken@example.com")).willReturn(true);

        // when & then
        assertThatThrownBy(() -> userService.updateUser(
                new UpdateUserCommand(TEST_USER_ID, "Test User", "taken@example.com", null)))
                .isInstanceOf(UserAlreadyExistsException.class);
    }

    @Test
    @DisplayName("사용자 삭제 실패 - 등록이 남아 있음")
    void deleteUser_HasRegistrations() {
        // given
        given(userRepository.existsById(TEST_USER_ID)).willReturn(true);
        given(userRegistrationPort.hasRegistrations(TEST_USER_ID)).willReturn(true);

        // when & then
        assertThatThrownBy(() -> userService.deleteUser(TEST_USER_ID))
                .isInstanceOf(UserHasRegistrationsException.class);
        verify(userRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("사용자 삭제 성공")
    void deleteUser_Success() {
        // given
        given(userRepository.existsById(TEST_USER_ID)).willReturn(true);
        given(userRegistrationPort.hasRegistrations(TEST_USER_ID)).willReturn(false);

        // when
        userService.deleteUser(TEST_USER_ID);

        // then
        verify(userRepository).deleteById(TEST_USER_ID);
    }

    @Test
    @DisplayName("사용자 삭제 실패 - 사용자 없음")
    void deleteUser_NotFound() {
        // given
        given(userRepository.existsById(TEST_USER_ID)).willReturn(false);

        // when & then
        assertThatThrownBy(() -> userService.deleteUser(TEST_USER_ID))
                .isInstanceOf(UserNotFoundException.class);
        verify(userRegistrationPort, never()).hasRegistrations(any());
    }
}
