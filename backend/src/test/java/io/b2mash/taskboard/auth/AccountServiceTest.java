package io.b2mash.taskboard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.taskboard.exception.AuthenticationFailedException;
import io.b2mash.taskboard.exception.FieldValidationException;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

  @Mock private UserRepository userRepository;
  @Mock private UserProfileRepository userProfileRepository;
  @Mock private PasswordEncoder passwordEncoder;
  @Mock private AuthTokenService authTokenService;
  @InjectMocks private AccountService accountService;

  @Test
  void register_collectsAllFieldErrorsBeforeSaving() {
    when(userRepository.existsByEmailIgnoreCase("a@example.com")).thenReturn(true);
    when(userRepository.existsByUsernameIgnoreCase("alice")).thenReturn(true);

    assertThatThrownBy(
            () ->
                accountService.register(
                    " A@Example.com ", "alice", "secret123", "secret124", null, null))
        .isInstanceOfSatisfying(
            FieldValidationException.class,
            ex -> assertThat(ex.getErrors()).containsOnlyKeys("password", "email", "username"));
    verify(userRepository, never()).save(any());
  }

  @Test
  void register_savesUserAndProfileAndIssuesToken() {
    when(passwordEncoder.encode("secret123")).thenReturn("hashed");
    when(userRepository.save(any(User.class)))
        .thenAnswer(
            inv -> {
              User saved = inv.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", 5L);
              return saved;
            });
    when(authTokenService.issueToken(any(User.class))).thenReturn("token");

    var result =
        accountService.register("a@example.com", "alice", "secret123", "secret123", "A", "L");

    assertThat(result.token()).isEqualTo("token");
    assertThat(result.user().getId()).isEqualTo(5L);
    assertThat(result.user().getPasswordHash()).isEqualTo("hashed");
    verify(userProfileRepository).save(any(UserProfile.class));
  }

  @Test
  void login_unknownEmailFailsWithoutHint() {
    when(userRepository.findByEmailIgnoreCase("nobody@example.com")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> accountService.login("nobody@example.com", "whatever"))
        .isInstanceOf(AuthenticationFailedException.class);
    verify(authTokenService, never()).issueToken(any());
  }

  @Test
  void login_wrongPasswordFails() {
    var user = new User("a@example.com", "alice", "hashed", null, null);
    when(userRepository.findByEmailIgnoreCase("a@example.com")).thenReturn(Optional.of(user));
    when(passwordEncoder.matches("wrong", "hashed")).thenReturn(false);

    assertThatThrownBy(() -> accountService.login("a@example.com", "wrong"))
        .isInstanceOfSatisfying(
            AuthenticationFailedException.class,
            ex -> assertThat(ex.getBody().getDetail()).isEqualTo("Invalid credentials"));
  }

  @Test
  void changePassword_wrongCurrentPasswordIsFieldError() {
    var user = new User("a@example.com", "alice", "hashed", null, null);
    when(userRepository.findById(5L)).thenReturn(Optional.of(user));
    when(passwordEncoder.matches("wrong", "hashed")).thenReturn(false);

    assertThatThrownBy(
            () -> accountService.changePassword(5L, "wrong", "newsecret1", "newsecret1"))
        .isInstanceOfSatisfying(
            FieldValidationException.class,
            ex -> assertThat(ex.getErrors()).containsOnlyKeys("current_password"));
    verify(passwordEncoder, never()).encode(any());
  }
}
