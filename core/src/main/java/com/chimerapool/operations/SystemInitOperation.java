package com.chimerapool.operations;

import com.chimerapool.auth.AuthService;
import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.db.User;
import com.chimerapool.db.UserRepository;
import com.chimerapool.security.PasswordHasher;
import com.chimerapool.security.Roles;
import com.chimerapool.util.UserValidation;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import javax.annotation.Nullable;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.tinylog.Logger;

/**
 * Operation class for initializing the system.
 *
 * <p>Creates the first super admin when no active one exists. Without a super admin nobody can
 * promote anyone, so this is the only way privileged accounts come into being.
 */
public class SystemInitOperation {

    private static final int GENERATED_PASSWORD_BYTES = 20;

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final Clock clock;
    private final SecureRandom random;

    public SystemInitOperation(
            UserRepository userRepository, PasswordHasher passwordHasher, Clock clock) {
        this(userRepository, passwordHasher, clock, new SecureRandom());
    }

    SystemInitOperation(
            UserRepository userRepository,
            PasswordHasher passwordHasher,
            Clock clock,
            SecureRandom random) {
        this.userRepository = Preconditions.checkNotNull(userRepository);
        this.passwordHasher = Preconditions.checkNotNull(passwordHasher);
        this.clock = Preconditions.checkNotNull(clock);
        this.random = Preconditions.checkNotNull(random);
    }

    /**
     * Result of the system initialization operation.
     *
     * @param generatedPassword The password generated for the new super admin, only set when the
     *     caller did not supply one; shown once and never stored
     */
    public record InitResult(
            boolean alreadyInitialized,
            @Nullable String generatedPassword,
            @Nullable Long userId,
            @Nullable String errorMessage) {

        public static InitResult success(@Nullable String generatedPassword, long userId) {
            return new InitResult(false, generatedPassword, userId, null);
        }

        @NotNull
        @Contract(" -> new")
        public static InitResult initialized() {
            return new InitResult(true, null, null, null);
        }

        public static InitResult error(String errorMessage) {
            return new InitResult(false, null, null, errorMessage);
        }

        public boolean isSuccess() {
            return errorMessage == null;
        }

        @Override
        public String toString() {
            return "InitResult[alreadyInitialized=" + alreadyInitialized
                    + ", userId=" + userId
                    + ", errorMessage=" + errorMessage + "]";
        }
    }

    /**
     * Creates the first super admin unless one already exists.
     *
     * @param username The username of the new super admin
     * @param email The email of the new super admin
     * @param password The password to set, or null to generate one
     * @return the initialization result
     */
    public InitResult execute(String username, String email, @Nullable String password) {
        Logger.info("Executing system initialization operation");

        StatusOr<Integer> countOr = userRepository.countUsersByRole(Roles.SUPER_ADMIN);
        if (countOr.isNotOk()) {
            Logger.error("Failed to count super admins: {}", countOr.getStatus().getMessage());
            return InitResult.error("Super admin lookup failed.");
        }
        if (countOr.getValue() > 0) {
            Logger.info("System is already initialized");
            return InitResult.initialized();
        }

        Instant now = clock.instant();
        User superAdmin =
                User.newUser(
                                Strings.nullToEmpty(username).trim(),
                                Strings.nullToEmpty(email).trim(),
                                now)
                        .withRole(Roles.SUPER_ADMIN, now);
        Status validation = UserValidation.validate(superAdmin);
        if (validation.isError()) {
            return InitResult.error(validation.getMessage());
        }

        String generatedPassword = null;
        String effectivePassword = password;
        if (UserValidation.isBlank(password)) {
            generatedPassword = generatePassword();
            effectivePassword = generatedPassword;
        } else if (password.length() < AuthService.MIN_PASSWORD_LENGTH) {
            return InitResult.error(
                    "password must be at least " + AuthService.MIN_PASSWORD_LENGTH
                            + " characters long");
        }

        StatusOr<String> hashOr = passwordHasher.hash(effectivePassword);
        if (hashOr.isNotOk()) {
            return InitResult.error(hashOr.getStatus().getMessage());
        }

        StatusOr<User> createdOr =
                userRepository.createUser(superAdmin.withPasswordHash(hashOr.getValue()));
        if (createdOr.isNotOk()) {
            Logger.error("Failed to create super admin: {}", createdOr.getStatus());
            return InitResult.error(createdOr.getStatus().getMessage());
        }

        long userId = createdOr.getValue().userId();
        Logger.info(
                "System initialized with super admin {} (id {})", superAdmin.username(), userId);
        return InitResult.success(generatedPassword, userId);
    }

    private String generatePassword() {
        byte[] bytes = new byte[GENERATED_PASSWORD_BYTES];
        random.nextBytes(bytes);
        return BaseEncoding.base32().omitPadding().encode(bytes);
    }
}
