package io.b2mash.taskboard.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds {@code requestId} and the caller ({@code userId} or {@code guestId}) to the MDC. Registered
 * inside the security chain, after bearer token authentication.
 */
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String MDC_REQUEST_ID = "requestId";
  static final String MDC_USER_ID = "userId";
  static final String MDC_GUEST_ID = "guestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth instanceof JwtAuthenticationToken jwtAuth) {
        MDC.put(MDC_USER_ID, jwtAuth.getToken().getSubject());
      } else {
        String guestId = request.getParameter(AccessPolicy.GUEST_ID_PARAMETER);
        if (guestId != null && !guestId.isBlank()) {
          MDC.put(MDC_GUEST_ID, guestId);
        }
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_GUEST_ID);
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
