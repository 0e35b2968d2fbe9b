package com.chimerapool.auth;

import com.chimerapool.common.status.ErrorKind;
import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.db.User;
import com.chimerapool.db.UserRepository;
import com.chimerapool.security.DefaultUserImpl;
import com.chimerapool.security.PasswordHasher;
import com.chimerapool.security.TokenClaims;
import com.chimerapool.security.TokenService;
import com.chimerapool.util.UserValidation;
import com.google.common.base.Preconditions;
import java.time.Clock;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * Registers users, logs them in, and turns access tokens back into principals.
 *
 * <p>The service holds no state besides its collaborators and is safe for concurrent use as long
 * as the repository is. Usernames and emails are trimmed before validation and storage; passwords
 * are never trimmed.
 */
public class AuthService {

  public static final int MIN_PASSWORD_LENGTH = 8;

  private final UserRepository userRepository;
  private final PasswordHasher passwordHasher;
  private final TokenService tokenService;
  private final Clock clock;

  public AuthService(
      UserRepository userRepository,
      PasswordHasher passwordHasher,
      TokenService tokenService,
      Clock clock) {
    this.userRepository = Preconditions.checkNotNull(userRepository);
    this.passwordHasher = Preconditions.checkNotNull(passwordHasher);
    this.tokenService = Preconditions.checkNotNull(tokenService);
    this.clock = Preconditions.checkNotNull(clock);
  }

  /**
   * Registers a new user with the {@code user} role.
   *
   * <p>Checks run in a fixed order and the first failure is returned: username, email and
   * password presence, password length, username and email format, then username and email
   * availability among active users.
   *
   * @return The stored user, carrying the password hash
   */
  public StatusOr<User> register(String username, String email, String password) {
    if (UserValidation.isBlank(username)) {
      return StatusOr.ofStatus(Status.invalidArgument("username is required"));
    }
    if (UserValidation.isBlank(email)) {
      return StatusOr.ofStatus(Status.invalidArgument("email is required"));
    }
    if (UserValidation.isBlank(password)) {
      return StatusOr.ofStatus(Status.invalidArgument("password is required"));
    }
    if (password.length() < MIN_PASSWORD_LENGTH) {
      return StatusOr.ofStatus(
          Status.invalidArgument(
              "password must be at least " + MIN_PASSWORD_LENGTH + " characters long"));
    }

    User candidate = User.newUser(username.trim(), email.trim(), clock.instant());
    Status validation = UserValidation.validate(candidate);
    if (validation.isError()) {
      return StatusOr.ofStatus(validation);
    }

    StatusOr<Optional<User>> byUsername = userRepository.getUserByUsername(candidate.username());
    if (byUsername.isNotOk()) {
      return byUsername.errorAs();
    }
    if (byUsername.getValue().filter(User::active).isPresent()) {
      return StatusOr.ofStatus(Status.alreadyExists("username already exists"));
    }

    StatusOr<Optional<User>> byEmail = userRepository.getUserByEmail(candidate.email());
    if (byEmail.isNotOk()) {
      return byEmail.errorAs();
    }
    if (byEmail.getValue().filter(User::active).isPresent()) {
      return StatusOr.ofStatus(Status.alreadyExists("email already exists"));
    }

    StatusOr<String> hashOr = passwordHasher.hash(password);
    if (hashOr.isNotOk()) {
      return hashOr.errorAs();
    }

    // The repository repeats the uniqueness check atomically; a concurrent registration that
    // got past the lookups above fails here.
    StatusOr<User> createdOr =
        userRepository.createUser(candidate.withPasswordHash(hashOr.getValue()));
    if (createdOr.isNotOk()) {
      Logger.info("Registration of {} rejected: {}", candidate.username(), createdOr.getStatus());
      return createdOr;
    }
    User created = createdOr.getValue();
    Logger.info("Registered user {} with id {}.", created.username(), created.userId());
    return createdOr;
  }

  /**
   * Authenticates a user and issues an access token.
   *
   * <p>An unknown username and a wrong password produce the same INVALID_CREDENTIALS status. A
   * soft-deleted account produces ACCOUNT_DISABLED.
   */
  public StatusOr<LoginResult> login(String username, String password) {
    if (UserValidation.isBlank(username)) {
      return StatusOr.ofStatus(Status.invalidArgument("username is required"));
    }
    if (UserValidation.isBlank(password)) {
      return StatusOr.ofStatus(Status.invalidArgument("password is required"));
    }

    StatusOr<Optional<User>> userOr = userRepository.getUserByUsername(username.trim());
    if (userOr.isNotOk()) {
      return userOr.errorAs();
    }
    if (userOr.getValue().isEmpty()) {
      Logger.debug("Login failed: unknown username.");
      return invalidCredentials();
    }

    User user = userOr.getValue().get();
    if (!user.active()) {
      Logger.info("Login refused for disabled account {}.", user.userId());
      return StatusOr.ofStatus(Status.of(ErrorKind.ACCOUNT_DISABLED, "account is disabled"));
    }
    if (!passwordHasher.verify(password, user.passwordHash())) {
      Logger.debug("Login failed: wrong password for user {}.", user.userId());
      return invalidCredentials();
    }

    StatusOr<String> tokenOr = tokenService.issue(user);
    if (tokenOr.isNotOk()) {
      return tokenOr.errorAs();
    }
    return StatusOr.ofValue(new LoginResult(user, tokenOr.getValue()));
  }

  /**
   * Validates an access token.
   *
   * @param token The raw token, with any {@code Bearer } prefix already removed
   * @return The claims, or one of the token error kinds
   */
  public StatusOr<TokenClaims> validateToken(String token) {
    return tokenService.validate(token);
  }

  /**
   * Loads the current state of the user a token was issued to, for use as the actor of
   * privileged operations.
   *
   * <p>Unlike {@link #validateToken}, this consults storage: a user deleted or disabled after the
   * token was issued is rejected here.
   *
   * @return The principal; USER_NOT_FOUND if the user no longer exists, ACCOUNT_DISABLED if it
   *     is inactive
   */
  public StatusOr<com.chimerapool.security.User> loadPrincipal(TokenClaims claims) {
    Preconditions.checkNotNull(claims, "claims must not be null");
    StatusOr<Optional<User>> userOr = userRepository.getUserById(claims.userId());
    if (userOr.isNotOk()) {
      return userOr.errorAs();
    }
    if (userOr.getValue().isEmpty()) {
      return StatusOr.ofStatus(Status.notFound("user not found"));
    }
    User user = userOr.getValue().get();
    if (!user.active()) {
      return StatusOr.ofStatus(Status.of(ErrorKind.ACCOUNT_DISABLED, "account is disabled"));
    }
    return StatusOr.ofValue(new DefaultUserImpl(user));
  }

  private static <T> StatusOr<T> invalidCredentials() {
    return StatusOr.ofStatus(Status.of(ErrorKind.INVALID_CREDENTIALS, "invalid credentials"));
  }
}
