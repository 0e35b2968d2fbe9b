package com.chimerapool.security;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

public abstract class BaseRoleImpl implements Role {

  private final Set<Permission> permissions;

  protected BaseRoleImpl(Permission... permissions) {
    this.permissions = ImmutableSet.copyOf(permissions);
  }

  @Override
  public boolean hasPermission(Permission permission) {
    return permissions.contains(permission);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", getName())
        .add("description", getDescription())
        .add("permissions", permissions)
        .toString();
  }
}
