package com.chimerapool.common.status;

/**
 * Status codes that correspond to both gRPC status codes and HTTP status codes. Callers that
 * expose this core over a transport map a {@link Status} to a response using {@link
 * #getHttpCode()}.
 */
public enum StatusCode {
  OK(200),
  INVALID_ARGUMENT(400),
  FAILED_PRECONDITION(400),
  UNAUTHENTICATED(401),
  PERMISSION_DENIED(403),
  NOT_FOUND(404),
  ALREADY_EXISTS(409),
  INTERNAL(500);

  private final int httpCode;

  StatusCode(int httpCode) {
    this.httpCode = httpCode;
  }

  /** Returns the corresponding HTTP status code. */
  public int getHttpCode() {
    return httpCode;
  }

  /** Returns whether this status code represents a successful operation. */
  public boolean isSuccess() {
    return this == OK;
  }

  /** Returns whether this status code represents an error. */
  public boolean isError() {
    return !isSuccess();
  }
}
