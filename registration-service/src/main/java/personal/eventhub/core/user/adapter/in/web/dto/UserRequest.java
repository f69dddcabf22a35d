package personal.eventhub.core.user.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.eventhub.core.user.application.port.in.CreateUserCommand;
import personal.eventhub.core.user.application.port.in.UpdateUserCommand;
import personal.eventhub.core.user.domain.model.UserRole;

/**
 * 사용자 생성/수정 요청 DTO
 */
public record UserRequest(
        @NotBlank(message = "이름은 필수입니다.")
        @Size(max = 100, message = "이름은 100자 이하여야 합니다.")
        String name,

        @NotBlank(message = "이메일은 필수입니다.")
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        String email,

        UserRole role
) {
    public CreateUserCommand toCreateCommand() {
        return new CreateUserCommand(name, email, role);
    }

    public UpdateUserCommand toUpdateCommand(Long userId) {
        return new UpdateUserCommand(userId, name, email, role);
    }
}
