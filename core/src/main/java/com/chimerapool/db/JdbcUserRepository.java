package com.chimerapool.db;

import com.chimerapool.common.status.ErrorKind;
import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.db.util.DbUtil;
import com.chimerapool.security.Roles;
import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * {@link UserRepository} backed by PostgreSQL.
 *
 * <p>Uniqueness among active users is enforced by partial unique indexes, so concurrent inserts
 * from any number of processes resolve in the database. The super-admin retention check locks
 * the active super-admin rows for the duration of its transaction.
 */
public class JdbcUserRepository implements UserRepository {

  static final String USERNAME_CONSTRAINT = "users_username_active_key";
  static final String EMAIL_CONSTRAINT = "users_email_active_key";

  private final DataSource dataSource;
  private final Clock clock;

  public JdbcUserRepository(DataSource dataSource, Clock clock) {
    this.dataSource = Preconditions.checkNotNull(dataSource);
    this.clock = Preconditions.checkNotNull(clock);
  }

  @Nonnull
  @Override
  public StatusOr<User> createUser(User user) {
    if (user == null) {
      return StatusOr.ofStatus(Status.invalidArgument("user is required"));
    }
    try (Connection conn = dataSource.getConnection()) {
      return Users.insert(conn, user);
    } catch (SQLException e) {
      Status conflict = conflictStatus(e);
      if (conflict != null) {
        return StatusOr.ofStatus(conflict);
      }
      Logger.error(e, "Failed to create user.");
      return StatusOr.ofException("Failed to create user", e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Optional<User>> getUserByUsername(String username) {
    try (Connection conn = dataSource.getConnection()) {
      return Users.loadByUsername(conn, username);
    } catch (SQLException e) {
      return StatusOr.ofException("Failed to load user", e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Optional<User>> getUserByEmail(String email) {
    try (Connection conn = dataSource.getConnection()) {
      return Users.loadByEmail(conn, email);
    } catch (SQLException e) {
      return StatusOr.ofException("Failed to load user", e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Optional<User>> getUserById(long userId) {
    try (Connection conn = dataSource.getConnection()) {
      return Users.loadById(conn, userId);
    } catch (SQLException e) {
      return StatusOr.ofException("Failed to load user", e);
    }
  }

  @Nonnull
  @Override
  public Status updateUser(User user) {
    if (user == null) {
      return Status.invalidArgument("user is required");
    }
    try (Connection conn = dataSource.getConnection()) {
      return update(conn, user);
    } catch (SQLException e) {
      return Status.internal("Failed to update user", e);
    }
  }

  @Nonnull
  @Override
  public Status updateRole(long userId, Roles role, Instant updatedAt) {
    if (role == null) {
      return Status.invalidArgument("role is required");
    }
    try (Connection conn = dataSource.getConnection()) {
      return setRole(conn, userId, role, updatedAt);
    } catch (SQLException e) {
      return Status.internal("Failed to update role", e);
    }
  }

  @Nonnull
  @Override
  public Status updateRoleRetainingSuperAdmin(long userId, Roles role, Instant updatedAt) {
    if (role == null) {
      return Status.invalidArgument("role is required");
    }
    try (Connection conn = dataSource.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        Status result = setRoleRetainingSuperAdmin(conn, userId, role, updatedAt);
        if (result.isOk()) {
          conn.commit();
        } else {
          conn.rollback();
        }
        return result;
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      Logger.error(e, "Failed to update role of user {}.", userId);
      return Status.internal("Failed to update role", e);
    }
  }

  @Nonnull
  @Override
  public Status deleteUser(long userId) {
    try (Connection conn = dataSource.getConnection()) {
      StatusOr<Integer> rowsOr = Users.deactivate(conn, userId, clock.instant());
      if (rowsOr.isNotOk()) {
        return rowsOr.getStatus();
      }
      return rowsOr.getValue() == 0 ? Status.notFound("user not found") : Status.ok();
    } catch (SQLException e) {
      return Status.internal("Failed to delete user", e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<List<User>> listUsersByRole(Roles role) {
    try (Connection conn = dataSource.getConnection()) {
      return Users.loadActiveByRole(conn, role);
    } catch (SQLException e) {
      return StatusOr.ofException("Failed to list users", e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Integer> countUsersByRole(Roles role) {
    try (Connection conn = dataSource.getConnection()) {
      return Users.countActiveByRole(conn, role);
    } catch (SQLException e) {
      return StatusOr.ofException("Failed to count users", e);
    }
  }

  private Status setRoleRetainingSuperAdmin(
      Connection conn, long userId, Roles role, Instant updatedAt) {
    StatusOr<Integer> countOr = Users.lockActiveSuperAdmins(conn);
    if (countOr.isNotOk()) {
      return countOr.getStatus();
    }
    if (countOr.getValue() <= 1) {
      return Status.of(ErrorKind.LAST_SUPER_ADMIN, "cannot remove the last super admin");
    }
    return setRole(conn, userId, role, updatedAt);
  }

  private static Status setRole(Connection conn, long userId, Roles role, Instant updatedAt) {
    StatusOr<Integer> rowsOr = Users.updateRole(conn, userId, role, updatedAt);
    if (rowsOr.isNotOk()) {
      return rowsOr.getStatus();
    }
    return rowsOr.getValue() == 0 ? Status.notFound("user not found") : Status.ok();
  }

  private Status update(Connection conn, User user) throws SQLException {
    try {
      StatusOr<Integer> rowsOr = Users.update(conn, user);
      if (rowsOr.isNotOk()) {
        return rowsOr.getStatus();
      }
      return rowsOr.getValue() == 0 ? Status.notFound("user not found") : Status.ok();
    } catch (SQLException e) {
      Status conflict = conflictStatus(e);
      if (conflict != null) {
        return conflict;
      }
      throw e;
    }
  }

  @Nullable
  private static Status conflictStatus(SQLException e) {
    if (DbUtil.violatesConstraint(e, USERNAME_CONSTRAINT)) {
      return Status.alreadyExists("username already exists");
    }
    if (DbUtil.violatesConstraint(e, EMAIL_CONSTRAINT)) {
      return Status.alreadyExists("email already exists");
    }
    return null;
  }
}
