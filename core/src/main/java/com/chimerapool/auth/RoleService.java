package com.chimerapool.auth;

import com.chimerapool.common.status.ErrorKind;
import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.db.UserRepository;
import com.chimerapool.security.Permission;
import com.chimerapool.security.Roles;
import com.chimerapool.security.User;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * Changes user roles and lists privileged users.
 *
 * <p>{@link #changeRole} evaluates its guards in a fixed order and returns the first failure.
 * Nothing is written unless every guard passes:
 *
 * <ol>
 *   <li>the new role is known, else INVALID_ROLE
 *   <li>the target user exists, active or not, else USER_NOT_FOUND
 *   <li>the actor is not the target, except a super admin stepping down to a lower role, else
 *       CANNOT_MODIFY_SELF
 *   <li>when the target is a super admin losing that role, another active super admin exists,
 *       else LAST_SUPER_ADMIN
 *   <li>the actor's role manages the target's current role, else PERMISSION_DENIED
 *   <li>the actor's role manages the new role, else PERMISSION_DENIED
 * </ol>
 *
 * <p>The last-super-admin count is checked again by the repository in the same atomic step as
 * the write, so concurrent demotions cannot remove every super admin.
 */
public class RoleService {

  private final UserRepository userRepository;
  private final Clock clock;

  public RoleService(UserRepository userRepository, Clock clock) {
    this.userRepository = Preconditions.checkNotNull(userRepository);
    this.clock = Preconditions.checkNotNull(clock);
  }

  /**
   * Parses {@code newRole} and changes the target's role.
   *
   * @see #changeRole(User, long, Roles)
   */
  public Status changeRole(User actor, long targetUserId, String newRole) {
    StatusOr<Roles> roleOr = Roles.fromValue(newRole);
    if (roleOr.isNotOk()) {
      return roleOr.getStatus();
    }
    return changeRole(actor, targetUserId, roleOr.getValue());
  }

  /**
   * Changes the role of a user on behalf of {@code actor}.
   *
   * @param actor The signed-in user performing the change
   * @param targetUserId The user whose role changes
   * @param newRole The role to assign
   * @return OK, or the status of the first guard that failed
   */
  public Status changeRole(User actor, long targetUserId, Roles newRole) {
    Preconditions.checkNotNull(actor, "actor must not be null");
    Status result = applyRoleChange(actor, targetUserId, newRole);
    if (result.isError()) {
      Logger.warn(
          "Role change of user {} by user {} rejected: {}", targetUserId, actor.getId(), result);
    }
    return result;
  }

  private Status applyRoleChange(User actor, long targetUserId, Roles newRole) {
    if (newRole == null) {
      return Status.of(ErrorKind.INVALID_ROLE, "invalid role");
    }

    StatusOr<Optional<com.chimerapool.db.User>> targetOr =
        userRepository.getUserById(targetUserId);
    if (targetOr.isNotOk()) {
      return targetOr.getStatus();
    }
    if (targetOr.getValue().isEmpty()) {
      return Status.notFound("user not found");
    }
    com.chimerapool.db.User target = targetOr.getValue().get();

    if (actor.getId() == target.userId()
        && !(actor.getRole() == Roles.SUPER_ADMIN && newRole != Roles.SUPER_ADMIN)) {
      return Status.of(ErrorKind.CANNOT_MODIFY_SELF, "cannot modify your own role");
    }

    boolean removesSuperAdmin = target.role() == Roles.SUPER_ADMIN && newRole != Roles.SUPER_ADMIN;
    if (removesSuperAdmin) {
      StatusOr<Integer> countOr = userRepository.countUsersByRole(Roles.SUPER_ADMIN);
      if (countOr.isNotOk()) {
        return countOr.getStatus();
      }
      if (countOr.getValue() <= 1) {
        return lastSuperAdmin();
      }
    }

    if (!actor.canManage(target.role())) {
      return Status.permissionDenied("insufficient permissions to modify this user");
    }
    if (!actor.canManage(newRole)) {
      return Status.permissionDenied("insufficient permissions to assign this role");
    }

    // Only the role is written; the rest of the record may have changed since the read above.
    Instant now = clock.instant();
    Status written =
        removesSuperAdmin
            ? userRepository.updateRoleRetainingSuperAdmin(target.userId(), newRole, now)
            : userRepository.updateRole(target.userId(), newRole, now);
    if (written.isError()) {
      return written;
    }
    Logger.info(
        "User {} changed role of user {} from {} to {}.",
        actor.getId(),
        target.userId(),
        target.role().value(),
        newRole.value());
    return Status.ok();
  }

  public Status promoteToModerator(User actor, long targetUserId) {
    return changeRole(actor, targetUserId, Roles.MODERATOR);
  }

  public Status promoteToAdmin(User actor, long targetUserId) {
    return changeRole(actor, targetUserId, Roles.ADMIN);
  }

  public Status demoteToUser(User actor, long targetUserId) {
    return changeRole(actor, targetUserId, Roles.USER);
  }

  /**
   * Lists active moderators. Requires admin or higher.
   *
   * @return The moderators ordered by id, or PERMISSION_DENIED
   */
  public StatusOr<List<com.chimerapool.db.User>> listModerators(User actor) {
    Preconditions.checkNotNull(actor, "actor must not be null");
    if (!actor.hasPermission(Permission.LIST_MODERATORS)) {
      return StatusOr.ofStatus(Status.permissionDenied("insufficient permissions"));
    }
    return userRepository.listUsersByRole(Roles.MODERATOR);
  }

  /**
   * Lists active admins and super admins. Requires super admin.
   *
   * @return Everyone at admin level or above ordered by id, or PERMISSION_DENIED
   */
  public StatusOr<List<com.chimerapool.db.User>> listAdmins(User actor) {
    Preconditions.checkNotNull(actor, "actor must not be null");
    if (!actor.hasPermission(Permission.LIST_ADMINS)) {
      return StatusOr.ofStatus(Status.permissionDenied("insufficient permissions"));
    }
    StatusOr<List<com.chimerapool.db.User>> adminsOr = userRepository.listUsersByRole(Roles.ADMIN);
    if (adminsOr.isNotOk()) {
      return adminsOr;
    }
    StatusOr<List<com.chimerapool.db.User>> superAdminsOr =
        userRepository.listUsersByRole(Roles.SUPER_ADMIN);
    if (superAdminsOr.isNotOk()) {
      return superAdminsOr;
    }
    return StatusOr.ofValue(
        ImmutableList.sortedCopyOf(
            Comparator.comparingLong(com.chimerapool.db.User::userId),
            ImmutableList.<com.chimerapool.db.User>builder()
                .addAll(adminsOr.getValue())
                .addAll(superAdminsOr.getValue())
                .build()));
  }

  private static Status lastSuperAdmin() {
    return Status.of(ErrorKind.LAST_SUPER_ADMIN, "cannot remove the last super admin");
  }
}
