package com.chimerapool.security;

import com.chimerapool.common.status.ErrorKind;
import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import java.util.Locale;
import javax.annotation.Nullable;

/**
 * The closed set of roles, ordered by privilege: {@code user < moderator < admin < super_admin}.
 *
 * <p>Each constant carries its stored value (the string persisted in the {@code role} column and
 * accepted by {@link #fromValue}), its privilege level, a display label, and the {@link Role}
 * implementation that answers permission checks.
 *
 * <p>The manage relation is expressed through permissions: an actor may manage a role when its
 * own role grants that role's {@link #managePermission()}. This yields
 *
 * <ul>
 *   <li>{@link #SUPER_ADMIN} manages every role, including itself
 *   <li>{@link #ADMIN} manages {@link #USER} and {@link #MODERATOR}
 *   <li>{@link #MODERATOR} and {@link #USER} manage nothing
 * </ul>
 *
 * <p>Usage:
 *
 * <pre>
 * StatusOr&lt;Roles&gt; parsed = Roles.fromValue("admin");
 * boolean allowed = Roles.ADMIN.canManage(Roles.MODERATOR); // true
 * </pre>
 */
public enum Roles {
  USER(
      "user",
      1,
      null,
      new BaseRoleImpl() {
        @Override
        public String getName() {
          return "USER";
        }

        @Override
        public String getDescription() {
          return "A regular user.";
        }
      }),

  MODERATOR(
      "moderator",
      2,
      "Moderator",
      new BaseRoleImpl() {
        @Override
        public String getName() {
          return "MODERATOR";
        }

        @Override
        public String getDescription() {
          return "A community moderator.";
        }
      }),

  ADMIN(
      "admin",
      3,
      "Admin",
      new BaseRoleImpl(
          Permission.MANAGE_USER_ROLE,
          Permission.MANAGE_MODERATOR_ROLE,
          Permission.LIST_MODERATORS) {
        @Override
        public String getName() {
          return "ADMIN";
        }

        @Override
        public String getDescription() {
          return "An administrator who manages users and moderators.";
        }
      }),

  /** The system owner. Holds every permission, including managing other super admins. */
  SUPER_ADMIN(
      "super_admin",
      4,
      "Super Admin",
      new Role() {
        @Override
        public String getName() {
          return "SUPER_ADMIN";
        }

        @Override
        public String getDescription() {
          return "The super administrator and system owner.";
        }

        @Override
        public boolean hasPermission(Permission permission) {
          return true;
        }
      });

  /** Older stored value for {@link #SUPER_ADMIN}, still accepted on input. */
  static final String LEGACY_SUPER_ADMIN_VALUE = "superadmin";

  private final String value;
  private final int level;
  @Nullable private final String badge;
  private final Role roleImpl;

  Roles(String value, int level, @Nullable String badge, Role roleImpl) {
    this.value = value;
    this.level = level;
    this.badge = badge;
    this.roleImpl = roleImpl;
  }

  /** Gets the role implementation associated with this enum constant. */
  public Role role() {
    return roleImpl;
  }

  /** The canonical stored value, e.g. {@code "super_admin"}. */
  public String value() {
    return value;
  }

  /** Privilege level, 1 for {@link #USER} through 4 for {@link #SUPER_ADMIN}. */
  public int level() {
    return level;
  }

  /**
   * Gets the badge label shown next to a user with this role.
   *
   * @return The label, or null for {@link #USER} which carries no badge
   */
  @Nullable
  public String badge() {
    return badge;
  }

  /** Returns true if this role is at least as privileged as {@code other}. */
  public boolean isAtLeast(Roles other) {
    return level >= other.level;
  }

  /** The permission an actor needs to move a user out of, or into, this role. */
  public Permission managePermission() {
    return switch (this) {
      case USER -> Permission.MANAGE_USER_ROLE;
      case MODERATOR -> Permission.MANAGE_MODERATOR_ROLE;
      case ADMIN -> Permission.MANAGE_ADMIN_ROLE;
      case SUPER_ADMIN -> Permission.MANAGE_SUPER_ADMIN_ROLE;
    };
  }

  /**
   * Checks the manage relation.
   *
   * @param target The role to be managed
   * @return true if a user with this role may act on users holding, or being given, {@code target}
   */
  public boolean canManage(Roles target) {
    return roleImpl.hasPermission(target.managePermission());
  }

  /**
   * Parses a role from its stored value.
   *
   * <p>Matching ignores case and surrounding whitespace. The legacy value {@code "superadmin"}
   * maps to {@link #SUPER_ADMIN}.
   *
   * @param value The value to parse
   * @return The role, or an INVALID_ROLE status if the value names no role
   */
  public static StatusOr<Roles> fromValue(@Nullable String value) {
    if (value == null) {
      return StatusOr.ofStatus(Status.of(ErrorKind.INVALID_ROLE, "invalid role"));
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (LEGACY_SUPER_ADMIN_VALUE.equals(normalized)) {
      return StatusOr.ofValue(SUPER_ADMIN);
    }
    for (Roles role : values()) {
      if (role.value.equals(normalized)) {
        return StatusOr.ofValue(role);
      }
    }
    return StatusOr.ofStatus(Status.of(ErrorKind.INVALID_ROLE, "invalid role: " + value));
  }
}
