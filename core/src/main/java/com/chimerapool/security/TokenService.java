package com.chimerapool.security;

import com.chimerapool.common.status.ErrorKind;
import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.util.UserValidation;
import com.google.common.base.Preconditions;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Date;
import javax.crypto.SecretKey;
import org.tinylog.Logger;

/**
 * Issues and validates HS256-signed access tokens.
 *
 * <p>Each instance holds its own signing key, supplied at construction, so several instances
 * with different secrets can coexist. Tokens expire a fixed {@link #TOKEN_TTL} after issue and
 * there is no revocation: expiry is the only way a token stops being valid.
 *
 * <p>Validation failures are reported with one of three kinds. A token that cannot be parsed,
 * fails signature verification, or was signed with another algorithm is {@link
 * ErrorKind#TOKEN_MALFORMED}; which of these happened is only logged.
 */
public class TokenService {

  public static final Duration TOKEN_TTL = Duration.ofHours(24);

  /** HS256 needs a key of at least 256 bits. */
  public static final int MIN_SECRET_BYTES = 32;

  static final String CLAIM_USER_ID = "user_id";
  static final String CLAIM_USERNAME = "username";
  static final String CLAIM_EMAIL = "email";

  private static final String ALGORITHM = "HS256";

  private final SecretKey key;
  private final Clock clock;
  private final JwtParser parser;

  public TokenService(String secret, Clock clock) {
    this(
        Preconditions.checkNotNull(secret, "secret must not be null")
            .getBytes(StandardCharsets.UTF_8),
        clock);
  }

  public TokenService(byte[] secret, Clock clock) {
    Preconditions.checkNotNull(secret, "secret must not be null");
    Preconditions.checkArgument(
        secret.length >= MIN_SECRET_BYTES,
        "signing secret must be at least %s bytes",
        MIN_SECRET_BYTES);
    this.key = Keys.hmacShaKeyFor(Arrays.copyOf(secret, secret.length));
    this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
    this.parser =
        Jwts.parser().verifyWith(key).clock(() -> Date.from(this.clock.instant())).build();
  }

  /**
   * Issues a token for the given user.
   *
   * @param user The stored user whose identity goes into the claims
   * @return The compact token, or a VALIDATION status if no user was given
   */
  public StatusOr<String> issue(com.chimerapool.db.User user) {
    if (user == null) {
      return StatusOr.ofStatus(Status.invalidArgument("user is required"));
    }
    Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = issuedAt.plus(TOKEN_TTL);
    try {
      String token =
          Jwts.builder()
              .claim(CLAIM_USER_ID, user.userId())
              .claim(CLAIM_USERNAME, user.username())
              .claim(CLAIM_EMAIL, user.email())
              .issuedAt(Date.from(issuedAt))
              .expiration(Date.from(expiresAt))
              .signWith(key, Jwts.SIG.HS256)
              .compact();
      return StatusOr.ofValue(token);
    } catch (JwtException e) {
      Logger.error(e, "Failed to sign token for user {}.", user.userId());
      return StatusOr.ofException("failed to generate token", e);
    }
  }

  /**
   * Validates a token and returns its claims.
   *
   * @param token The raw token, without any {@code Bearer } prefix
   * @return The claims; or TOKEN_EMPTY, TOKEN_MALFORMED or TOKEN_EXPIRED
   */
  public StatusOr<TokenClaims> validate(String token) {
    if (UserValidation.isBlank(token)) {
      return tokenError(ErrorKind.TOKEN_EMPTY, "token is required");
    }

    Jws<Claims> jws;
    try {
      jws = parser.parseSignedClaims(token.trim());
    } catch (ExpiredJwtException e) {
      // Expiry is detected after the signature check but before ours on the algorithm.
      if (!ALGORITHM.equals(e.getHeader().getAlgorithm())) {
        Logger.debug("Rejected expired token signed with {}", e.getHeader().getAlgorithm());
        return malformed();
      }
      return tokenError(ErrorKind.TOKEN_EXPIRED, "token expired");
    } catch (JwtException | IllegalArgumentException e) {
      Logger.debug("Rejected token: {}", e.getMessage());
      return malformed();
    }

    if (!ALGORITHM.equals(jws.getHeader().getAlgorithm())) {
      Logger.debug("Rejected token signed with {}", jws.getHeader().getAlgorithm());
      return malformed();
    }

    Claims claims = jws.getPayload();
    Object userId = claims.get(CLAIM_USER_ID);
    Object username = claims.get(CLAIM_USERNAME);
    Object email = claims.get(CLAIM_EMAIL);
    Date issuedAt = claims.getIssuedAt();
    Date expiration = claims.getExpiration();
    if (!(userId instanceof Number)
        || !(username instanceof String)
        || !(email instanceof String)
        || issuedAt == null
        || expiration == null
        || !expiration.after(issuedAt)) {
      Logger.debug("Rejected token with missing or inconsistent claims");
      return malformed();
    }

    // The parser only rejects once now is past exp; a token is already dead at exp.
    Instant expiresAt = expiration.toInstant();
    if (!clock.instant().isBefore(expiresAt)) {
      return tokenError(ErrorKind.TOKEN_EXPIRED, "token expired");
    }

    return StatusOr.ofValue(
        new TokenClaims(
            ((Number) userId).longValue(),
            (String) username,
            (String) email,
            issuedAt.toInstant(),
            expiresAt));
  }

  private static StatusOr<TokenClaims> malformed() {
    return tokenError(ErrorKind.TOKEN_MALFORMED, "invalid token");
  }

  private static StatusOr<TokenClaims> tokenError(ErrorKind kind, String message) {
    return StatusOr.ofStatus(Status.of(kind, message));
  }
}
