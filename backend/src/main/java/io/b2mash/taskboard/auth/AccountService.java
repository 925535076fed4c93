package io.b2mash.taskboard.auth;

import io.b2mash.taskboard.exception.AuthenticationFailedException;
import io.b2mash.taskboard.exception.FieldValidationException;
import io.b2mash.taskboard.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {

  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  private final UserRepository userRepository;
  private final UserProfileRepository userProfileRepository;
  private final PasswordEncoder passwordEncoder;
  private final AuthTokenService authTokenService;

  public AccountService(
      UserRepository userRepository,
      UserProfileRepository userProfileRepository,
      PasswordEncoder passwordEncoder,
      AuthTokenService authTokenService) {
    this.userRepository = userRepository;
    this.userProfileRepository = userProfileRepository;
    this.passwordEncoder = passwordEncoder;
    this.authTokenService = authTokenService;
  }

  /** A user together with a freshly issued bearer token. */
  public record AuthenticatedUser(User user, String token) {}

  /** A user together with their profile. */
  public record UserWithProfile(User user, UserProfile profile) {}

  @Transactional
  public AuthenticatedUser register(
      String email,
      String username,
      String password,
      String repeatedPassword,
      String firstName,
      String lastName) {
    String normalizedEmail = normalizeEmail(email);
    Map<String, List<String>> errors = new LinkedHashMap<>();
    if (!password.equals(repeatedPassword)) {
      addError(errors, "password", "Passwords do not match");
    }
    if (userRepository.existsByEmailIgnoreCase(normalizedEmail)) {
      addError(errors, "email", "A user with this email already exists");
    }
    if (userRepository.existsByUsernameIgnoreCase(username)) {
      addError(errors, "username", "A user with this username already exists");
    }
    if (!errors.isEmpty()) {
      throw new FieldValidationException(errors);
    }

    var user =
        userRepository.save(
            new User(
                normalizedEmail, username, passwordEncoder.encode(password), firstName, lastName));
    userProfileRepository.save(new UserProfile(user.getId()));
    log.info("Registered user {}", user.getId());
    return new AuthenticatedUser(user, authTokenService.issueToken(user));
  }

  @Transactional(readOnly = true)
  public AuthenticatedUser login(String email, String password) {
    var user = userRepository.findByEmailIgnoreCase(normalizeEmail(email)).orElse(null);
    if (user == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
      log.warn("security.login_failed: user_found={}", user != null);
      throw new AuthenticationFailedException();
    }
    log.info("User {} logged in", user.getId());
    return new AuthenticatedUser(user, authTokenService.issueToken(user));
  }

  /** Returns the user's profile, creating an empty one if the user has none yet. */
  @Transactional
  public UserWithProfile getProfile(Long userId) {
    var user = requireUser(userId);
    return new UserWithProfile(user, profileFor(userId));
  }

  @Transactional
  public UserWithProfile updateProfile(Long userId, String bio, String location) {
    var user = requireUser(userId);
    var profile = profileFor(userId);
    profile.update(bio, location);
    profile = userProfileRepository.save(profile);
    log.info("Updated profile of user {}", userId);
    return new UserWithProfile(user, profile);
  }

  @Transactional
  public void changePassword(
      Long userId, String currentPassword, String newPassword, String repeatedNewPassword) {
    var user = requireUser(userId);
    Map<String, List<String>> errors = new LinkedHashMap<>();
    if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
      addError(errors, "current_password", "Current password is incorrect");
    }
    if (!newPassword.equals(repeatedNewPassword)) {
      addError(errors, "new_password", "Passwords do not match");
    }
    if (!errors.isEmpty()) {
      throw new FieldValidationException(errors);
    }
    user.changePasswordHash(passwordEncoder.encode(newPassword));
    userRepository.save(user);
    log.info("Changed password of user {}", userId);
  }

  private User requireUser(Long userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  private UserProfile profileFor(Long userId) {
    return userProfileRepository
        .findByUserId(userId)
        .orElseGet(
            () -> {
              log.info("Creating missing profile for user {}", userId);
              return userProfileRepository.save(new UserProfile(userId));
            });
  }

  private static void addError(Map<String, List<String>> errors, String field, String message) {
    errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
  }

  static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
