package com.chimerapool.security;

/**
 * A named set of permissions in the role hierarchy.
 *
 * <p>Each user carries exactly one role. The concrete roles are the constants of {@link Roles};
 * this interface is what those constants delegate permission checks to.
 */
public interface Role extends PermissionChecker {
  /**
   * Gets the unique name of this role.
   *
   * @return The role's name in uppercase (e.g., "ADMIN", "USER")
   */
  String getName();

  /** Gets the human-readable description of this role. */
  String getDescription();
}
