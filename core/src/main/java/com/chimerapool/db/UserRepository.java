package com.chimerapool.db;

import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.security.Roles;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Storage contract for {@link User} records.
 *
 * <p>Implementations own the lifetime of stored users and must be safe for concurrent use. The
 * services built on top of this interface hold no state of their own, so every synchronization
 * requirement lives here:
 *
 * <ul>
 *   <li>{@link #createUser} checks uniqueness and inserts as one atomic step. Of two concurrent
 *       creations with the same active username, exactly one succeeds.
 *   <li>{@link #updateRoleRetainingSuperAdmin} counts active super admins and writes against the
 *       same consistent snapshot.
 * </ul>
 *
 * <p>Usernames and emails are unique among <em>active</em> users only; the username or email of
 * a soft-deleted user may be taken again. "Not found" is an empty {@link Optional}, not an
 * error. List and count operations see active users only.
 */
public interface UserRepository {

  /**
   * Stores a new user.
   *
   * @param user The user to store; its {@code userId} is ignored
   * @return The stored record carrying its assigned identifier, or ALREADY_EXISTS with message
   *     "username already exists" or "email already exists"
   */
  @Nonnull
  StatusOr<User> createUser(User user);

  /**
   * Looks up a user by exact username.
   *
   * <p>The active user holding the name wins. Without one, the most recently created
   * soft-deleted user with that name is returned, so that callers can tell a disabled account
   * from an unknown one.
   */
  @Nonnull
  StatusOr<Optional<User>> getUserByUsername(String username);

  /** Looks up a user by exact email, with the same preference as {@link #getUserByUsername}. */
  @Nonnull
  StatusOr<Optional<User>> getUserByEmail(String email);

  /** Looks up a user by identifier, whether active or not. */
  @Nonnull
  StatusOr<Optional<User>> getUserById(long userId);

  /**
   * Replaces a stored user with the given record.
   *
   * @return OK, USER_NOT_FOUND if no user has the record's id, or ALREADY_EXISTS if the change
   *     would collide with another active user's username or email
   */
  @Nonnull
  Status updateUser(User user);

  /**
   * Sets the role of a stored user, active or not. No other field is written, so a soft delete
   * or password change made since the caller read the user is kept.
   *
   * @return OK, or USER_NOT_FOUND if no user has the identifier
   */
  @Nonnull
  Status updateRole(long userId, Roles role, Instant updatedAt);

  /**
   * Like {@link #updateRole}, but only if more than one active super admin exists.
   *
   * <p>The count and the write are atomic with respect to other calls of this method, so two
   * concurrent demotions of the last two super admins cannot both succeed.
   *
   * @return OK, LAST_SUPER_ADMIN if one or fewer active super admins exist, or USER_NOT_FOUND
   */
  @Nonnull
  Status updateRoleRetainingSuperAdmin(long userId, Roles role, Instant updatedAt);

  /**
   * Soft-deletes a user by clearing its active flag.
   *
   * @return OK, or USER_NOT_FOUND
   */
  @Nonnull
  Status deleteUser(long userId);

  /** Lists active users holding the given role, ordered by identifier. */
  @Nonnull
  StatusOr<List<User>> listUsersByRole(Roles role);

  /** Counts active users holding the given role. */
  @Nonnull
  StatusOr<Integer> countUsersByRole(Roles role);
}
