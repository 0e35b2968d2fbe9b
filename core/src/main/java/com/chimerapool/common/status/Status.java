package com.chimerapool.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Represents the status of an operation, possibly with additional error details. This class is
 * inspired by the gRPC Status concept and provides a unified way to represent success or one of the
 * {@link ErrorKind} failures.
 *
 * <p>Messages are meant to be shown to callers. They never contain a password, a password hash, a
 * token or the signing secret.
 */
public class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null, null);

  private final StatusCode code;
  private final ErrorKind kind;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, ErrorKind kind, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.kind = kind;
    this.message = message;
    this.cause = cause;
  }

  /** Creates a new error status of the given kind. */
  public static Status of(@Nonnull ErrorKind kind, String message) {
    return new Status(kind.getDefaultCode(), kind, message, null);
  }

  /** Creates a new error status of the given kind, message, and cause. */
  public static Status of(@Nonnull ErrorKind kind, String message, Throwable cause) {
    return new Status(kind.getDefaultCode(), kind, message, cause);
  }

  /** Returns the OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates a new VALIDATION status with the given message. */
  public static Status invalidArgument(String message) {
    return of(ErrorKind.VALIDATION, message);
  }

  /** Creates a new ALREADY_EXISTS status with the given message. */
  public static Status alreadyExists(String message) {
    return of(ErrorKind.ALREADY_EXISTS, message);
  }

  /** Creates a new USER_NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return of(ErrorKind.USER_NOT_FOUND, message);
  }

  /** Creates a new PERMISSION_DENIED status with the given message. */
  public static Status permissionDenied(String message) {
    return of(ErrorKind.PERMISSION_DENIED, message);
  }

  /** Creates a new INTERNAL status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return of(ErrorKind.INTERNAL, message, cause);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the kind of failure, or null for the OK status. */
  @Nullable
  public ErrorKind getKind() {
    return kind;
  }

  /** Returns true if this status is an error of the given kind. */
  public boolean is(ErrorKind errorKind) {
    return kind == errorKind;
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code != StatusCode.OK;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code == StatusCode.OK;
  }

  @Override
  public String toString() {
    if (kind == null) {
      return code.toString();
    }
    if (message == null) {
      return code + "/" + kind;
    }
    return code + "/" + kind + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && kind == other.kind
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, kind, message, cause);
  }
}
