package com.chimerapool.security;

/**
 * A signed-in user as seen by authorization checks.
 *
 * <p>The concrete implementation wraps a {@code db.User} record and answers permission checks
 * through the user's single {@link Roles role}.
 */
public interface User extends PermissionChecker {
  /** Gets the user's identifier. */
  long getId();

  String getUsername();

  String getEmail();

  /** Gets the role the user held when this principal was loaded. */
  Roles getRole();

  /**
   * Checks if the user is active (not soft-deleted).
   *
   * @return true if the account is active
   */
  boolean isActive();

  /**
   * Checks the manage relation between this user's role and {@code target}.
   *
   * @param target The role to act on
   * @return true if this user may move users out of, or into, {@code target}
   */
  default boolean canManage(Roles target) {
    return getRole().canManage(target);
  }
}
