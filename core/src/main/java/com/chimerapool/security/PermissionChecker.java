package com.chimerapool.security;

/**
 * Contract for anything that can answer a permission question, a role or a signed-in user.
 *
 * <p>Implementers decide from their own state (a permission set, the role assigned to a user)
 * whether a permission is held. The default methods combine single checks.
 */
public interface PermissionChecker {
  /**
   * Checks if this entity has the specified permission.
   *
   * @param permission The permission to check
   * @return true if the entity has the permission, false otherwise
   */
  boolean hasPermission(Permission permission);

  /** Returns true if at least one of the permissions is held. */
  default boolean hasAnyPermission(Permission... permissions) {
    for (Permission p : permissions) {
      if (hasPermission(p)) {
        return true;
      }
    }
    return false;
  }

  /** Returns true only if every one of the permissions is held. */
  default boolean hasAllPermissions(Permission... permissions) {
    for (Permission p : permissions) {
      if (!hasPermission(p)) {
        return false;
      }
    }
    return true;
  }
}
