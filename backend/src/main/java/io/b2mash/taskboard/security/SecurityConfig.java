package io.b2mash.taskboard.security;

import jakarta.servlet.DispatcherType;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final AuthFailureEntryPoint authFailureEntryPoint;
  private final Environment environment;

  public SecurityConfig(AuthFailureEntryPoint authFailureEntryPoint, Environment environment) {
    this.authFailureEntryPoint = authFailureEntryPoint;
    this.environment = environment;
  }

  /**
   * Stateless bearer-token chain. Task, subtask and contact routes accept guests; summary, board,
   * boards and account routes require a user; anything unlisted is denied.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    var guestOrUser = new AccessPolicyAuthorizationManager(new GuestOrAuthenticatedAccessPolicy());
    var userOnly = new AccessPolicyAuthorizationManager(new AuthenticatedAccessPolicy());

    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.dispatcherTypeMatchers(DispatcherType.ERROR)
                    .permitAll()
                    .requestMatchers("/actuator/health", "/actuator/health/**")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/api/auth/registration", "/api/auth/login")
                    .permitAll()
                    .requestMatchers(
                        "/api/tasks",
                        "/api/tasks/*",
                        "/api/subtasks",
                        "/api/subtasks/*",
                        "/api/contacts",
                        "/api/contacts/*")
                    .access(guestOrUser)
                    .requestMatchers(
                        "/api/summary",
                        "/api/board",
                        "/api/boards",
                        "/api/boards/*",
                        "/api/auth/profile",
                        "/api/auth/password")
                    .access(userOnly)
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(Customizer.withDefaults())
                    .authenticationEntryPoint(authFailureEntryPoint))
        .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(authFailureEntryPoint))
        .addFilterAfter(new RequestLoggingFilter(), BearerTokenAuthenticationFilter.class);

    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
