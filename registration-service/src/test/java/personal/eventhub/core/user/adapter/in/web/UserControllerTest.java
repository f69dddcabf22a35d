package personal.eventhub.core.user.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.eventhub.core.user.application.port.in.CreateUserCommand;
import personal.eventhub.core.user.application.port.in.GetUserUseCase;
import personal.eventhub.core.user.application.port.in.ManageUserUseCase;
import personal.eventhub.core.user.domain.exception.UserAlreadyExistsException;
import personal.eventhub.core.user.domain.exception.UserHasRegistrationsException;
import personal.eventhub.core.user.domain.exception.UserNotFoundException;
import personal.eventhub.core.user.domain.model.User;
import personal.eventhub.core.user.domain.model.UserRole;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UserController.class)
@DisplayName("User API 단위 테스트")
class UserControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetUserUseCase getUserUseCase;
    @MockBean
    private ManageUserUseCase manageUserUseCase;

    @Test
    @DisplayName("사용자 생성 시 201을 반환한다")
    void createUser_Created() throws Exception {
        // given
        given(manageUserUseCase.createUser(new CreateUserCommand("Kim", "kim@example.com", UserRole.ORGANIZER)))
                .willReturn(new User(1L, "Kim", "kim@example.com", UserRole.ORGANIZER));

        // when & then
        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Kim\",\"email\":\"kim@example.com\",\"role\":\"ORGANIZER\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.role").value("ORGANIZER"));
    }

    @Test
    @DisplayName("이메일 형식이 잘못되면 400을 반환한다")
    void createUser_InvalidEmail() throws Exception {
        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Kim\",\"email\":\"not-an-email\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("이메일 형식이 올바르지 않습니다."));
    }

    @Test
    @DisplayName("중복 이메일은 409를 반환한다")
    void createUser_Duplicate() throws Exception {
        // given
        given(manageUserUseCase.createUser(any())).willThrow(new UserAlreadyExistsException("kim@example.com"));

        // when & then
        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Kim\",\"email\":\"kim@example.com\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("U002"));
    }

    @Test
    @DisplayName("없는 사용자 조회는 404를 반환한다")
    void getUser_NotFound() throws Exception {
        // given
        given(getUserUseCase.getUser(7L)).willThrow(new UserNotFoundException(7L));

        // when & then
        mockMvc.perform(get("/api/v1/users/7"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("U001"));
    }

    @Test
    @DisplayName("등록이 남은 사용자 삭제는 409를 반환한다")
    void deleteUser_HasRegistrations() throws Exception {
        // given
        willThrow(new UserHasRegistrationsException(1L)).given(manageUserUseCase).deleteUser(1L);

        // when & then
        mockMvc.perform(delete("/api/v1/users/1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("U003"));
    }
}
