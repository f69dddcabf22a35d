package personal.eventhub.core.user.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.eventhub.common.dto.ApiResponse;
import personal.eventhub.core.user.adapter.in.web.dto.UserRequest;
import personal.eventhub.core.user.adapter.in.web.dto.UserResponse;
import personal.eventhub.core.user.application.port.in.GetUserUseCase;
import personal.eventhub.core.user.application.port.in.ManageUserUseCase;
import personal.eventhub.core.user.domain.model.User;

/**
 * User API Controller
 * 사용자 생성/조회/수정/삭제 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final GetUserUseCase getUserUseCase;
    private final ManageUserUseCase manageUserUseCase;

    /**
     * 사용자 생성
     * POST /api/v1/users
     */
    @PostMapping
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody UserRequest request) {
        log.info("Create user: role={}", request.role());

        User user = manageUserUseCase.createUser(request.toCreateCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    /**
     * 사용자 조회
     * GET /api/v1/users/{userId}
     */
    @GetMapping("/{userId}")
    public ResponseEntity<UserResponse> getUser(@PathVariable Long userId) {
        log.info("Get user: userId={}", userId);
        return ResponseEntity.ok(UserResponse.from(getUserUseCase.getUser(userId)));
    }

    /**
     * 사용자 수정
     * PUT /api/v1/users/{userId}
     */
    @PutMapping("/{userId}")
    public ResponseEntity<UserResponse> updateUser(
            @PathVariable Long userId,
            @Valid @RequestBody UserRequest request
    ) {
        log.info("Update user: userId={}", userId);

        User user = manageUserUseCase.updateUser(request.toUpdateCommand(userId));

        return ResponseEntity.ok(UserResponse.from(user));
    }

    /**
     * 사용자 삭제
     * DELETE /api/v1/users/{userId}
     */
    @DeleteMapping("/{userId}")
    public ResponseEntity<ApiResponse<Void>> deleteUser(@PathVariable Long userId) {
        log.info("Delete user: userId={}", userId);

        manageUserUseCase.deleteUser(userId);

        return ResponseEntity.ok(ApiResponse.success("User deleted successfully"));
    }
}
