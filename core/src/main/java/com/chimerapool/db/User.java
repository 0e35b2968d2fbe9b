package com.chimerapool.db;

import com.chimerapool.security.Roles;
import com.google.common.base.MoreObjects;
import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Represents a row in the 'users' table.
 *
 * <p>The record is immutable; changes produce a copy through the {@code with...} methods and are
 * persisted through {@link UserRepository}. A user that has not been created yet has a {@code
 * userId} of zero; the repository assigns the real identifier on creation.
 *
 * @param userId The identifier assigned by the repository, or 0 before creation
 * @param username The unique (among active users) login name
 * @param email The unique (among active users) email address
 * @param passwordHash The self-contained bcrypt hash; never serialized outward
 * @param role The user's role
 * @param active False once the user has been soft-deleted
 * @param createdAt Timestamp when the record was created
 * @param updatedAt Timestamp when the record was last updated
 */
public record User(
    long userId,
    String username,
    String email,
    @Nullable String passwordHash,
    Roles role,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {

  public User {
    Objects.requireNonNull(role, "role must not be null");
    if (userId < 0) {
      throw new IllegalArgumentException("userId must not be negative");
    }
  }

  /**
   * Creates a not-yet-persisted, active user with the {@link Roles#USER} role.
   *
   * @param username The trimmed username
   * @param email The trimmed email
   * @param now Creation time used for both timestamps
   */
  public static User newUser(String username, String email, Instant now) {
    return new User(0L, username, email, null, Roles.USER, true, now, now);
  }

  /** Returns true once the repository has assigned an identifier. */
  public boolean isPersisted() {
    return userId > 0;
  }

  public User withUserId(long newUserId) {
    return new User(
        newUserId, username, email, passwordHash, role, active, createdAt, updatedAt);
  }

  public User withPasswordHash(String newPasswordHash) {
    return new User(
        userId, username, email, newPasswordHash, role, active, createdAt, updatedAt);
  }

  public User withRole(Roles newRole, Instant now) {
    return new User(userId, username, email, passwordHash, newRole, active, createdAt, now);
  }

  public User withActive(boolean newActive, Instant now) {
    return new User(userId, username, email, passwordHash, role, newActive, createdAt, now);
  }

  /** Returns a string representation without the password hash. */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("userId", userId)
        .add("username", username)
        .add("email", email)
        .add("role", role.value())
        .add("active", active)
        .add("createdAt", createdAt)
        .add("updatedAt", updatedAt)
        .toString();
  }
}
