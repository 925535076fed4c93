package io.b2mash.taskboard.auth;

import io.b2mash.taskboard.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

  static final int MIN_PASSWORD_LENGTH = 8;

  private final AccountService accountService;

  public AuthController(AccountService accountService) {
    this.accountService = accountService;
  }

  @PostMapping("/api/auth/registration")
  public ResponseEntity<TokenResponse> register(@Valid @RequestBody RegistrationRequest request) {
    var result =
        accountService.register(
            request.email(),
            request.username(),
            request.password(),
            request.repeatedPassword(),
            request.firstName(),
            request.lastName());
    return ResponseEntity.created(URI.create("/api/auth/profile"))
        .body(TokenResponse.from(result));
  }

  @PostMapping("/api/auth/login")
  public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
    return ResponseEntity.ok(
        TokenResponse.from(accountService.login(request.email(), request.password())));
  }

  @PostMapping("/api/auth/password")
  public ResponseEntity<Void> changePassword(@Valid @RequestBody PasswordChangeRequest request) {
    accountService.changePassword(
        CurrentUser.requireUserId(),
        request.currentPassword(),
        request.newPassword(),
        request.repeatedNewPassword());
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record RegistrationRequest(
      @NotBlank(message = "email is required")
          @Email(message = "email must be a valid email address")
          @Size(max = 254, message = "email must be at most 254 characters")
          String email,
      @NotBlank(message = "username is required")
          @Size(max = 150, message = "username must be at most 150 characters")
          String username,
      @NotBlank(message = "password is required")
          @Size(min = MIN_PASSWORD_LENGTH, message = "password must be at least 8 characters")
          String password,
      @NotBlank(message = "repeated_password is required") String repeatedPassword,
      @Size(max = 150, message = "first_name must be at most 150 characters") String firstName,
      @Size(max = 150, message = "last_name must be at most 150 characters") String lastName) {}

  public record LoginRequest(
      @NotBlank(message = "email is required") String email,
      @NotBlank(message = "password is required") String password) {}

  public record PasswordChangeRequest(
      @NotBlank(message = "current_password is required") String currentPassword,
      @NotBlank(message = "new_password is required")
          @Size(min = MIN_PASSWORD_LENGTH, message = "new_password must be at least 8 characters")
          String newPassword,
      @NotBlank(message = "repeated_new_password is required") String repeatedNewPassword) {}

  public record TokenResponse(String token, Long userId, String email, String username) {

    public static TokenResponse from(AccountService.AuthenticatedUser result) {
      var user = result.user();
      return new TokenResponse(result.token(), user.getId(), user.getEmail(), user.getUsername());
    }
  }
}
