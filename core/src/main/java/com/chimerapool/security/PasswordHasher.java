package com.chimerapool.security;

import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.util.UserValidation;
import com.google.common.base.Preconditions;
import java.security.SecureRandom;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.tinylog.Logger;

/**
 * One-way salted password hashing with bcrypt.
 *
 * <p>Hashes are self-contained: the salt and cost factor are encoded in the hash string, so a
 * hash made with one cost still verifies after the configured cost changes. Two hashes of the
 * same password differ because each gets a fresh salt.
 */
public class PasswordHasher {

  public static final int DEFAULT_COST = 10;
  public static final int MIN_COST = 4;
  public static final int MAX_COST = 31;

  private final PasswordEncoder encoder;
  private final int cost;

  public PasswordHasher() {
    this(DEFAULT_COST);
  }

  public PasswordHasher(int cost) {
    this(cost, new SecureRandom());
  }

  public PasswordHasher(int cost, SecureRandom random) {
    Preconditions.checkArgument(
        cost >= MIN_COST && cost <= MAX_COST,
        "bcrypt cost must be between %s and %s, got %s",
        MIN_COST,
        MAX_COST,
        cost);
    this.cost = cost;
    this.encoder = new BCryptPasswordEncoder(cost, Preconditions.checkNotNull(random));
  }

  public int getCost() {
    return cost;
  }

  /**
   * Hashes a plaintext password.
   *
   * @param password The plaintext password
   * @return The bcrypt hash, a VALIDATION status if the password is empty, or INTERNAL if the
   *     hashing primitive fails (for example on passwords longer than bcrypt's 72-byte limit)
   */
  public StatusOr<String> hash(String password) {
    if (UserValidation.isBlank(password)) {
      return StatusOr.ofStatus(Status.invalidArgument("password is required"));
    }
    try {
      return StatusOr.ofValue(encoder.encode(password));
    } catch (RuntimeException e) {
      Logger.warn(e, "Password hashing failed.");
      return StatusOr.ofException("failed to hash password", e);
    }
  }

  /**
   * Checks a plaintext password against a stored hash.
   *
   * @return true only on a match; false for empty inputs, a mismatch, or a malformed hash
   */
  public boolean verify(String password, String hash) {
    if (UserValidation.isBlank(password) || UserValidation.isBlank(hash)) {
      return false;
    }
    try {
      return encoder.matches(password, hash);
    } catch (RuntimeException e) {
      Logger.debug("Password verification failed: {}", e.getMessage());
      return false;
    }
  }
}
