/*
 * Where: notification service layer
 * What: issues and verifies the signed token embedded in the welcome email link
 * Why: the link must prove which user and address it was sent to without server-side state
 */
package com.example.notifyhub.notification.service;

import com.example.notifyhub.notification.config.EmailVerificationProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class EmailVerificationTokenService {

  private static final Logger logger = LoggerFactory.getLogger(EmailVerificationTokenService.class);
  private static final String CLAIM_EMAIL = "email";
  private static final String CLAIM_PURPOSE = "purpose";
  private static final String PURPOSE = "email_verification";

  private final EmailVerificationProperties properties;
  private final Clock clock;
  private final byte[] secret;

  public EmailVerificationTokenService(EmailVerificationProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
    this.secret = properties.secret().getBytes(StandardCharsets.UTF_8);
  }

  /** Claims of a token that passed signature, expiry and purpose checks. */
  public record VerifiedEmail(String userId, String email) {}

  public String issueToken(String userId, String email) {
    final Instant now = Instant.now(clock);
    final JWTClaimsSet claims =
        new JWTClaimsSet.Builder()
            .jwtID(UUID.randomUUID().toString())
            .subject(userId)
            .claim(CLAIM_EMAIL, email)
            .claim(CLAIM_PURPOSE, PURPOSE)
            .issueTime(Date.from(now))
            .expirationTime(Date.from(now.plus(properties.ttl())))
            .build();
    try {
      final SignedJWT signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      final JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);
      logger.debug("issued email verification token userId={}", userId);
      return signedJwt.serialize();
    } catch (JOSEException ex) {
      throw new IllegalStateException("failed to sign email verification token", ex);
    }
  }

  public String verificationUrl(String userId, String email) {
    return UriComponentsBuilder.fromUriString(properties.baseUrl())
        .path(properties.verifyPath())
        .queryParam("token", issueToken(userId, email))
        .build()
        .toUriString();
  }

  public VerifiedEmail verify(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidVerificationTokenException("verification token is required");
    }
    try {
      final SignedJWT signedJwt = SignedJWT.parse(token);
      final JWSVerifier verifier = new MACVerifier(secret);
      if (!signedJwt.verify(verifier)) {
        throw new InvalidVerificationTokenException("invalid verification token signature");
      }
      final JWTClaimsSet claims = signedJwt.getJWTClaimsSet();
      if (claims.getExpirationTime() == null
          || !claims.getExpirationTime().toInstant().isAfter(Instant.now(clock))) {
        throw new InvalidVerificationTokenException("verification token has expired");
      }
      if (!PURPOSE.equals(claims.getStringClaim(CLAIM_PURPOSE))
          || claims.getSubject() == null
          || claims.getSubject().isBlank()) {
        throw new InvalidVerificationTokenException("token is not an email verification token");
      }
      return new VerifiedEmail(claims.getSubject(), claims.getStringClaim(CLAIM_EMAIL));
    } catch (ParseException | JOSEException ex) {
      throw new InvalidVerificationTokenException("invalid verification token", ex);
    }
  }
}
