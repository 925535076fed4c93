package io.b2mash.taskboard.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;

/**
 * Admits authenticated users, and anonymous callers that identify themselves with a non-blank
 * {@code guest_id} query parameter.
 */
public class GuestOrAuthenticatedAccessPolicy implements AccessPolicy {

  @Override
  public boolean permits(Authentication authentication, HttpServletRequest request) {
    if (AccessPolicy.isAuthenticatedUser(authentication)) {
      return true;
    }
    String guestId = request.getParameter(GUEST_ID_PARAMETER);
    return guestId != null && !guestId.isBlank();
  }
}
