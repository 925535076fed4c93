package io.b2mash.taskboard.security;

import java.util.function.Supplier;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/** Plugs an {@link AccessPolicy} into {@code authorizeHttpRequests}. */
public class AccessPolicyAuthorizationManager
    implements AuthorizationManager<RequestAuthorizationContext> {

  private final AccessPolicy policy;

  public AccessPolicyAuthorizationManager(AccessPolicy policy) {
    this.policy = policy;
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    return new AuthorizationDecision(policy.permits(authentication.get(), context.getRequest()));
  }
}
