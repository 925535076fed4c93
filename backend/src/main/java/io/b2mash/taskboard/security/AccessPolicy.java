package io.b2mash.taskboard.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;

/**
 * Decides whether a caller may reach a group of endpoints. Every protected route is bound to
 * exactly one policy in {@link SecurityConfig}; there is no permissive variant.
 */
public interface AccessPolicy {

  String GUEST_ID_PARAMETER = "guest_id";

  /**
   * @param authentication the current authentication, possibly anonymous or {@code null}
   * @param request the incoming request
   * @return {@code true} if the request may proceed
   */
  boolean permits(Authentication authentication, HttpServletRequest request);

  static boolean isAuthenticatedUser(Authentication authentication) {
    return authentication != null
        && authentication.isAuthenticated()
        && !(authentication instanceof AnonymousAuthenticationToken);
  }
}
