package com.chimerapool.config;

import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.security.PasswordHasher;
import com.chimerapool.security.TokenService;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

/**
 * Configuration record for credential handling.
 *
 * @param jwtSecret The symmetric secret tokens are signed with; at least 32 bytes
 * @param bcryptCost The bcrypt work factor for new password hashes
 */
public record AuthConfig(String jwtSecret, int bcryptCost) {

  public static final String JWT_SECRET_ENV = "JWT_SECRET";
  public static final String BCRYPT_COST_ENV = "BCRYPT_COST";

  /**
   * Reads the configuration from environment variables.
   *
   * <p>{@code JWT_SECRET} is required. {@code BCRYPT_COST} is optional and defaults to {@link
   * PasswordHasher#DEFAULT_COST}. The token lifetime is not configurable.
   *
   * @param env The environment, usually {@link System#getenv()}
   * @return The configuration, or INVALID_ARGUMENT naming the offending variable
   */
  public static StatusOr<AuthConfig> fromEnvironment(Map<String, String> env) {
    String secret = env.get(JWT_SECRET_ENV);
    if (Strings.isNullOrEmpty(secret)) {
      return StatusOr.ofStatus(Status.invalidArgument(JWT_SECRET_ENV + " is required"));
    }
    if (secret.getBytes(StandardCharsets.UTF_8).length < TokenService.MIN_SECRET_BYTES) {
      return StatusOr.ofStatus(
          Status.invalidArgument(
              JWT_SECRET_ENV + " must be at least " + TokenService.MIN_SECRET_BYTES + " bytes"));
    }

    int cost = PasswordHasher.DEFAULT_COST;
    String rawCost = env.get(BCRYPT_COST_ENV);
    if (!Strings.isNullOrEmpty(rawCost)) {
      try {
        cost = Integer.parseInt(rawCost.trim());
      } catch (NumberFormatException e) {
        return StatusOr.ofStatus(Status.invalidArgument(BCRYPT_COST_ENV + " must be an integer"));
      }
      if (cost < PasswordHasher.MIN_COST || cost > PasswordHasher.MAX_COST) {
        return StatusOr.ofStatus(
            Status.invalidArgument(
                BCRYPT_COST_ENV
                    + " must be between "
                    + PasswordHasher.MIN_COST
                    + " and "
                    + PasswordHasher.MAX_COST));
      }
    }
    return StatusOr.ofValue(new AuthConfig(secret, cost));
  }

  public TokenService newTokenService(Clock clock) {
    return new TokenService(jwtSecret, clock);
  }

  public PasswordHasher newPasswordHasher() {
    return new PasswordHasher(bcryptCost);
  }

  /** Returns a string representation of this object without the secret. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("bcryptCost", bcryptCost)
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
