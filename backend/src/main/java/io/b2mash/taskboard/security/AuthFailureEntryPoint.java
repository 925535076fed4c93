package io.b2mash.taskboard.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Logs a warning for every rejected request, then lets {@link BearerTokenAuthenticationEntryPoint}
 * write the 401 with its {@code WWW-Authenticate} header.
 */
@Component
public class AuthFailureEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(AuthFailureEntryPoint.class);

  private final BearerTokenAuthenticationEntryPoint delegate;

  public AuthFailureEntryPoint() {
    this.delegate = new BearerTokenAuthenticationEntryPoint();
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException) {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage(),
        request.getRemoteAddr());

    delegate.commence(request, response, authException);
  }
}
