package com.chimerapool.security;

/**
 * Permissions granted by roles.
 *
 * <p>The {@code MANAGE_*_ROLE} permissions describe which users an actor may re-role: an actor
 * holding {@code MANAGE_X_ROLE} may move a user whose current role is X, and may assign role X to
 * a user. The listing permissions gate {@code listModerators} and {@code listAdmins}.
 */
public enum Permission {
  MANAGE_USER_ROLE,
  MANAGE_MODERATOR_ROLE,
  MANAGE_ADMIN_ROLE,
  MANAGE_SUPER_ADMIN_ROLE,
  LIST_MODERATORS,
  LIST_ADMINS
}
