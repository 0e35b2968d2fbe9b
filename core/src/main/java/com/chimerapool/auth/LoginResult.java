package com.chimerapool.auth;

import com.chimerapool.db.User;
import com.google.common.base.MoreObjects;

/**
 * The outcome of a successful login.
 *
 * @param user The stored user that logged in
 * @param token The freshly issued access token
 */
public record LoginResult(User user, String token) {

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("user", user).add("token", "<redacted>").toString();
  }
}
