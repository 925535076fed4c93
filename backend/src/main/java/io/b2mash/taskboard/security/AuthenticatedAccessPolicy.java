package io.b2mash.taskboard.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;

/** Admits only callers holding a valid bearer token. */
public class AuthenticatedAccessPolicy implements AccessPolicy {

  @Override
  public boolean permits(Authentication authentication, HttpServletRequest request) {
    return AccessPolicy.isAuthenticatedUser(authentication);
  }
}
