package io.b2mash.taskboard.security;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/** Reads the authenticated user from the security context of the current request. */
public final class CurrentUser {

  private CurrentUser() {}

  /** Returns the id of the user the bearer token was issued to. */
  public static Long requireUserId() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      return Long.valueOf(jwtAuth.getToken().getSubject());
    }
    throw new AuthenticationCredentialsNotFoundException("No authenticated user in context");
  }
}
