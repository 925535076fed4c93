package io.b2mash.taskboard.auth;

import io.b2mash.taskboard.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

  private final AccountService accountService;

  public ProfileController(AccountService accountService) {
    this.accountService = accountService;
  }

  @GetMapping("/api/auth/profile")
  public ResponseEntity<ProfileResponse> getProfile() {
    return ResponseEntity.ok(
        ProfileResponse.from(accountService.getProfile(CurrentUser.requireUserId())));
  }

  @PatchMapping("/api/auth/profile")
  public ResponseEntity<ProfileResponse> updateProfile(
      @Valid @RequestBody ProfileUpdateRequest request) {
    var updated =
        accountService.updateProfile(
            CurrentUser.requireUserId(), request.bio(), request.location());
    return ResponseEntity.ok(ProfileResponse.from(updated));
  }

  // --- DTOs ---

  public record ProfileUpdateRequest(
      @Size(max = 2000, message = "bio must be at most 2000 characters") String bio,
      @Size(max = 100, message = "location must be at most 100 characters") String location) {}

  public record ProfileResponse(
      Long userId,
      String email,
      String username,
      String bio,
      String location,
      Instant createdAt) {

    public static ProfileResponse from(AccountService.UserWithProfile userWithProfile) {
      var user = userWithProfile.user();
      var profile = userWithProfile.profile();
      return new ProfileResponse(
          user.getId(),
          user.getEmail(),
          user.getUsername(),
          profile.getBio(),
          profile.getLocation(),
          profile.getCreatedAt());
    }
  }
}
