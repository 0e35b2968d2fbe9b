package com.chimerapool.common.status;

/**
 * The kinds of failure the credential and role core can report.
 *
 * <p>A kind is finer-grained than a {@link StatusCode}: several kinds share a code (for example
 * {@link #CANNOT_MODIFY_SELF} and {@link #LAST_SUPER_ADMIN} are both {@link
 * StatusCode#FAILED_PRECONDITION}), but callers and tests can always tell them apart.
 */
public enum ErrorKind {
  /** Missing, malformed, too short or too long input. */
  VALIDATION(StatusCode.INVALID_ARGUMENT),

  /** A username or email collides with an active user. */
  ALREADY_EXISTS(StatusCode.ALREADY_EXISTS),

  /** Unknown username or wrong password; the two are deliberately indistinguishable. */
  INVALID_CREDENTIALS(StatusCode.UNAUTHENTICATED),

  /** The account exists and the password may be right, but the account is inactive. */
  ACCOUNT_DISABLED(StatusCode.PERMISSION_DENIED),

  /** The presented token is blank. */
  TOKEN_EMPTY(StatusCode.UNAUTHENTICATED),

  /** The token cannot be parsed, is unsigned, or its signature does not verify. */
  TOKEN_MALFORMED(StatusCode.UNAUTHENTICATED),

  /** The token is intact but its expiry has been reached. */
  TOKEN_EXPIRED(StatusCode.UNAUTHENTICATED),

  PERMISSION_DENIED(StatusCode.PERMISSION_DENIED),

  USER_NOT_FOUND(StatusCode.NOT_FOUND),

  /** The requested role is not one of the known roles. */
  INVALID_ROLE(StatusCode.INVALID_ARGUMENT),

  /** The actor tried to change their own role. */
  CANNOT_MODIFY_SELF(StatusCode.FAILED_PRECONDITION),

  /** The change would leave no active super_admin. */
  LAST_SUPER_ADMIN(StatusCode.FAILED_PRECONDITION),

  /** Storage, hashing or signing failed. */
  INTERNAL(StatusCode.INTERNAL);

  private final StatusCode defaultCode;

  ErrorKind(StatusCode defaultCode) {
    this.defaultCode = defaultCode;
  }

  /** Returns the status code a status of this kind carries. */
  public StatusCode getDefaultCode() {
    return defaultCode;
  }

  /** Returns true for the three token failures (empty, malformed, expired). */
  public boolean isTokenError() {
    return this == TOKEN_EMPTY || this == TOKEN_MALFORMED || this == TOKEN_EXPIRED;
  }
}
