package com.chimerapool.security;

import com.google.common.base.MoreObjects;
import java.util.Objects;

/**
 * Default implementation of {@link User}, wrapping a stored user record.
 *
 * <p>Permissions come from the record's role. The principal is a snapshot: a role change made
 * after the record was loaded is not visible until the user is loaded again.
 */
public class DefaultUserImpl implements User {

  private final com.chimerapool.db.User dbUser;

  /**
   * Creates a principal for the given stored user.
   *
   * @param dbUser The database user record to wrap
   */
  public DefaultUserImpl(com.chimerapool.db.User dbUser) {
    this.dbUser = Objects.requireNonNull(dbUser, "dbUser must not be null");
  }

  public static DefaultUserImpl of(com.chimerapool.db.User dbUser) {
    return new DefaultUserImpl(dbUser);
  }

  /** Returns the wrapped record. */
  public com.chimerapool.db.User dbUser() {
    return dbUser;
  }

  @Override
  public long getId() {
    return dbUser.userId();
  }

  @Override
  public String getUsername() {
    return dbUser.username();
  }

  @Override
  public String getEmail() {
    return dbUser.email();
  }

  @Override
  public Roles getRole() {
    return dbUser.role();
  }

  @Override
  public boolean isActive() {
    return dbUser.active();
  }

  @Override
  public boolean hasPermission(Permission permission) {
    return dbUser.role().role().hasPermission(permission);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", getId())
        .add("username", getUsername())
        .add("role", getRole().value())
        .add("active", isActive())
        .toString();
  }
}
