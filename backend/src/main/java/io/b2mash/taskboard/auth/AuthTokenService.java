package io.b2mash.taskboard.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.b2mash.taskboard.config.JwtProperties;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues the HS256 bearer tokens handed out at registration and login. Verification is done by the
 * resource server's {@code JwtDecoder}, configured with the same secret.
 */
@Service
public class AuthTokenService {

  private static final Logger log = LoggerFactory.getLogger(AuthTokenService.class);

  public static final String EMAIL_CLAIM = "email";
  public static final String USERNAME_CLAIM = "username";

  private final JwtProperties jwtProperties;

  public AuthTokenService(JwtProperties jwtProperties) {
    this.jwtProperties = jwtProperties;
  }

  /**
   * Issues a signed token for the given user.
   *
   * @param user a persisted user
   * @return compact JWS string whose subject is the user id
   */
  public String issueToken(User user) {
    try {
      Instant now = Instant.now();
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(user.getId().toString())
              .claim(EMAIL_CLAIM, user.getEmail())
              .claim(USERNAME_CLAIM, user.getUsername())
              .issueTime(Date.from(now))
              .expirationTime(Date.from(now.plus(jwtProperties.ttl())))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(jwtProperties.secretBytes());
      signedJwt.sign(signer);

      log.debug("Issued token for user {}", user.getId());
      return signedJwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign auth token", e);
    }
  }
}
