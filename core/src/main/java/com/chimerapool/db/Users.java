package com.chimerapool.db;

import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.db.util.DbUtil;
import com.chimerapool.security.Roles;
import com.google.common.collect.ImmutableList;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * DAO helper class for the 'users' table.
 *
 * <p>Every method works on a caller-supplied connection and leaves transaction control to the
 * caller. SQL errors are returned as statuses, except from {@link #insert} and {@link #update},
 * which throw so the caller can interpret unique violations through {@link
 * DbUtil#isUniqueViolation}.
 */
public final class Users {

    private static final String COLUMNS =
            "id, username, email, password_hash, role, is_active, created_at, updated_at";

    private Users() {
        // Utility class
    }

    /**
     * Inserts a new user row.
     *
     * @param conn an open JDBC connection
     * @param user the user to insert; its id is ignored
     * @return StatusOr containing the inserted user with its generated id
     * @throws SQLException if the insert fails, including on unique violations
     */
    @Nonnull
    public static StatusOr<User> insert(Connection conn, User user) throws SQLException {
        String sql = """
                INSERT INTO users
                       (username, email, password_hash, role, is_active, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                RETURNING id
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, user.username());
            stmt.setString(2, user.email());
            stmt.setString(3, user.passwordHash());
            stmt.setString(4, user.role().value());
            stmt.setBoolean(5, user.active());
            stmt.setTimestamp(6, DbUtil.toSqlTimestamp(user.createdAt()));
            stmt.setTimestamp(7, DbUtil.toSqlTimestamp(user.updatedAt()));
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return StatusOr.ofStatus(
                            Status.internal("Insert returned no id", new SQLException("no rows")));
                }
                return StatusOr.ofValue(user.withUserId(rs.getLong("id")));
            }
        }
    }

    /**
     * Loads a single user by ID, active or not.
     *
     * @param conn an open JDBC connection
     * @param userId the id of the user to load
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadById(Connection conn, long userId) {
        String sql = "SELECT " + COLUMNS + " FROM users WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, userId);
            return loadOne(stmt);
        } catch (SQLException e) {
            return StatusOr.ofException("Failed to load user", e);
        }
    }

    /**
     * Loads the user with the given username, preferring the active one and then the newest
     * inactive one.
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadByUsername(Connection conn, String username) {
        String sql = "SELECT " + COLUMNS + " FROM users WHERE username = ?"
                + " ORDER BY is_active DESC, id DESC LIMIT 1";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, username);
            return loadOne(stmt);
        } catch (SQLException e) {
            return StatusOr.ofException("Failed to load user", e);
        }
    }

    /** Loads the user with the given email, with the same preference as by username. */
    @Nonnull
    public static StatusOr<Optional<User>> loadByEmail(Connection conn, String email) {
        String sql = "SELECT " + COLUMNS + " FROM users WHERE email = ?"
                + " ORDER BY is_active DESC, id DESC LIMIT 1";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, email);
            return loadOne(stmt);
        } catch (SQLException e) {
            return StatusOr.ofException("Failed to load user", e);
        }
    }

    /**
     * Loads the active users holding a role.
     *
     * @param conn an open JDBC connection
     * @param role the role to filter by
     * @return StatusOr containing the users ordered by id
     */
    @Nonnull
    public static StatusOr<List<User>> loadActiveByRole(Connection conn, Roles role) {
        String sql = "SELECT " + COLUMNS + " FROM users WHERE role = ? AND is_active ORDER BY id";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, role.value());
            try (ResultSet rs = stmt.executeQuery()) {
                ImmutableList.Builder<User> result = ImmutableList.builder();
                while (rs.next()) {
                    StatusOr<User> userOr = extractUser(rs);
                    if (userOr.isNotOk()) {
                        return userOr.errorAs();
                    }
                    result.add(userOr.getValue());
                }
                return StatusOr.ofValue(result.build());
            }
        } catch (SQLException e) {
            return StatusOr.ofException("Failed to list users", e);
        }
    }

    /** Counts the active users holding a role. */
    @Nonnull
    public static StatusOr<Integer> countActiveByRole(Connection conn, Roles role) {
        String sql = "SELECT COUNT(*) FROM users WHERE role = ? AND is_active";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, role.value());
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return StatusOr.ofValue(rs.getInt(1));
            }
        } catch (SQLException e) {
            return StatusOr.ofException("Failed to count users", e);
        }
    }

    /**
     * Locks the rows of all active super admins and returns how many there are. Must run inside a
     * transaction; the locks are held until it ends.
     */
    @Nonnull
    public static StatusOr<Integer> lockActiveSuperAdmins(Connection conn) {
        // FOR UPDATE cannot be combined with an aggregate, so the rows are counted here.
        String sql = "SELECT id FROM users WHERE role = ? AND is_active FOR UPDATE";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, Roles.SUPER_ADMIN.value());
            try (ResultSet rs = stmt.executeQuery()) {
                int count = 0;
                while (rs.next()) {
                    count++;
                }
                return StatusOr.ofValue(count);
            }
        } catch (SQLException e) {
            return StatusOr.ofException("Failed to lock super admins", e);
        }
    }

    /**
     * Updates every mutable column of a user row.
     *
     * @param conn an open JDBC connection
     * @param user the new state of the row
     * @return StatusOr containing the number of affected rows
     * @throws SQLException if the update fails, including on unique violations
     */
    @Nonnull
    public static StatusOr<Integer> update(Connection conn, User user) throws SQLException {
        String sql = """
                UPDATE users
                   SET username      = ?,
                       email         = ?,
                       password_hash = ?,
                       role          = ?,
                       is_active     = ?,
                       updated_at    = ?
                 WHERE id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, user.username());
            stmt.setString(2, user.email());
            stmt.setString(3, user.passwordHash());
            stmt.setString(4, user.role().value());
            stmt.setBoolean(5, user.active());
            stmt.setTimestamp(6, DbUtil.toSqlTimestamp(user.updatedAt()));
            stmt.setLong(7, user.userId());
            return StatusOr.ofValue(stmt.executeUpdate());
        }
    }

    /**
     * Sets the role column of a user row and nothing else besides updated_at.
     *
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> updateRole(
            Connection conn, long userId, Roles role, Instant updatedAt) {
        String sql = "UPDATE users SET role = ?, updated_at = ? WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, role.value());
            stmt.setTimestamp(2, DbUtil.toSqlTimestamp(updatedAt));
            stmt.setLong(3, userId);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofException("Failed to update role", e);
        }
    }

    /**
     * Clears the active flag of a user.
     *
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> deactivate(Connection conn, long userId, Instant now) {
        String sql = "UPDATE users SET is_active = FALSE, updated_at = ? WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setTimestamp(1, DbUtil.toSqlTimestamp(now));
            stmt.setLong(2, userId);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofException("Failed to deactivate user", e);
        }
    }

    private static StatusOr<Optional<User>> loadOne(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                StatusOr<User> userOr = extractUser(rs);
                if (userOr.isNotOk()) {
                    return userOr.errorAs();
                }
                return StatusOr.ofValue(Optional.of(userOr.getValue()));
            }
            return StatusOr.ofValue(Optional.empty());
        }
    }

    /**
     * Extracts a User from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<User> extractUser(ResultSet rs) throws SQLException {
        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return createdAtOr.errorAs();
        }

        StatusOr<Instant> updatedAtOr = DbUtil.getInstant(rs, "updated_at");
        if (updatedAtOr.isNotOk()) {
            return updatedAtOr.errorAs();
        }

        StatusOr<Roles> roleOr = Roles.fromValue(rs.getString("role"));
        if (roleOr.isNotOk()) {
            return roleOr.errorAs();
        }

        return StatusOr.ofValue(new User(
                rs.getLong("id"),
                rs.getString("username"),
                rs.getString("email"),
                rs.getString("password_hash"),
                roleOr.getValue(),
                rs.getBoolean("is_active"),
                createdAtOr.getValue(),
                updatedAtOr.getValue()));
    }
}
