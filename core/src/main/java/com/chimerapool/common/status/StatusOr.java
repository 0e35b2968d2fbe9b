package com.chimerapool.common.status;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The result of an operation that yields a value: either the value, or a non-OK {@link Status}
 * explaining why there is none.
 *
 * <p>Expected failures (bad input, a missing user, an expired token) travel as statuses instead
 * of exceptions. A caller that cannot handle an error passes it up with {@link #errorAs()}.
 *
 * @param <T> The type of the value in case of success.
 */
public final class StatusOr<T> {

  private final Status status;
  @Nullable private final T value;

  private StatusOr(Status status, @Nullable T value) {
    this.status = status;
    this.value = value;
  }

  /**
   * Wraps a successful result.
   *
   * @throws NullPointerException if value is null
   */
  public static <T> StatusOr<T> ofValue(@Nonnull T value) {
    return new StatusOr<>(Status.ok(), Preconditions.checkNotNull(value, "value must not be null"));
  }

  /**
   * Wraps a failure.
   *
   * @throws IllegalArgumentException if status is OK
   */
  public static <T> StatusOr<T> ofStatus(@Nonnull Status status) {
    Preconditions.checkNotNull(status, "status must not be null");
    Preconditions.checkArgument(!status.isOk(), "an OK status needs a value");
    return new StatusOr<>(status, null);
  }

  /**
   * Wraps an unexpected exception as an INTERNAL failure. The exception message is not copied
   * into the status message; it stays reachable through {@link Status#getCause()}.
   *
   * @param message the caller-facing description of what failed
   * @param throwable the exception that caused the failure
   */
  public static <T> StatusOr<T> ofException(String message, @Nonnull Throwable throwable) {
    return ofStatus(Status.internal(message, throwable));
  }

  /** Returns the status; OK when a value is present. */
  @Nonnull
  public Status getStatus() {
    return status;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if this result is a failure
   */
  @Nonnull
  public T getValue() {
    Preconditions.checkState(status.isOk(), "no value in failed result: %s", status);
    return value;
  }

  public boolean isOk() {
    return status.isOk();
  }

  public boolean isNotOk() {
    return !status.isOk();
  }

  /**
   * Re-types a failed result so it can be returned from a method producing another value type.
   *
   * @throws IllegalStateException if this result holds a value
   */
  @Nonnull
  public <U> StatusOr<U> errorAs() {
    Preconditions.checkState(status.isError(), "errorAs() called on a successful result");
    return new StatusOr<>(status, null);
  }

  @Override
  public String toString() {
    MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this);
    if (status.isOk()) {
      return helper.add("value", value).toString();
    }
    return helper.add("status", status).toString();
  }
}
