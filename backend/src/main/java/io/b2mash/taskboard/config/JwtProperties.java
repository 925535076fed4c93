package io.b2mash.taskboard.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Signing settings for the bearer tokens issued at registration and login.
 *
 * @param secret HMAC key, at least 32 bytes once UTF-8 encoded
 * @param ttl token lifetime, 24 hours when unset
 */
@ConfigurationProperties(prefix = "taskboard.auth.jwt")
public record JwtProperties(String secret, Duration ttl) {

  static final int MIN_SECRET_BYTES = 32;
  static final Duration DEFAULT_TTL = Duration.ofHours(24);

  public JwtProperties {
    if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "taskboard.auth.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (ttl == null) {
      ttl = DEFAULT_TTL;
    }
  }

  public byte[] secretBytes() {
    return secret.getBytes(StandardCharsets.UTF_8);
  }
}
