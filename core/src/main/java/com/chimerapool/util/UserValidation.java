package com.chimerapool.util;

import com.chimerapool.common.status.Status;
import com.chimerapool.db.User;
import com.google.common.base.Strings;
import java.util.regex.Pattern;

/** Structural validation for user records. */
public final class UserValidation {

  public static final int MIN_USERNAME_LENGTH = 3;
  public static final int MAX_USERNAME_LENGTH = 50;

  // Dot-separated atoms on both sides, no empty labels, and an alphabetic TLD of 2+ characters.
  private static final Pattern EMAIL_PATTERN =
      Pattern.compile(
          "^[A-Za-z0-9_%+-]+(?:\\.[A-Za-z0-9_%+-]+)*"
              + "@[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?"
              + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?)*"
              + "\\.[A-Za-z]{2,}$");

  private UserValidation() {
    // Utility class, no instances
  }

  /** Returns true if the string is blank after trimming (null counts as blank). */
  public static boolean isBlank(String value) {
    return Strings.isNullOrEmpty(value) || value.trim().isEmpty();
  }

  /** Returns true if the email has a plausible address format. */
  public static boolean isValidEmail(String email) {
    return email != null && EMAIL_PATTERN.matcher(email).matches();
  }

  /**
   * Validates the username and email of a user.
   *
   * @param user The user to validate
   * @return OK, or a VALIDATION status describing the first problem found
   */
  public static Status validate(User user) {
    Status usernameStatus = validateUsername(user.username());
    if (usernameStatus.isError()) {
      return usernameStatus;
    }
    return validateEmail(user.email());
  }

  /** Validates a username: required, 3 to 50 characters counted as code points. */
  public static Status validateUsername(String username) {
    if (isBlank(username)) {
      return Status.invalidArgument("username is required");
    }
    int length = username.codePointCount(0, username.length());
    if (length < MIN_USERNAME_LENGTH) {
      return Status.invalidArgument(
          "username must be at least " + MIN_USERNAME_LENGTH + " characters long");
    }
    if (length > MAX_USERNAME_LENGTH) {
      return Status.invalidArgument(
          "username must be at most " + MAX_USERNAME_LENGTH + " characters long");
    }
    return Status.ok();
  }

  /** Validates an email: required, address format. */
  public static Status validateEmail(String email) {
    if (isBlank(email)) {
      return Status.invalidArgument("email is required");
    }
    if (!isValidEmail(email)) {
      return Status.invalidArgument("invalid email format");
    }
    return Status.ok();
  }
}
