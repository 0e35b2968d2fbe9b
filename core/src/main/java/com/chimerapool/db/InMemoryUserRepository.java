package com.chimerapool.db;

import com.chimerapool.common.status.ErrorKind;
import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.security.Roles;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * {@link UserRepository} kept in process memory.
 *
 * <p>A single read/write lock guards the whole map, which makes every operation atomic. Suitable
 * for tests and single-process deployments; data is lost on restart.
 */
public class InMemoryUserRepository implements UserRepository {

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<Long, User> usersById = new TreeMap<>();
  private final Clock clock;
  private long nextId = 1L;

  public InMemoryUserRepository() {
    this(Clock.systemUTC());
  }

  public InMemoryUserRepository(Clock clock) {
    this.clock = Preconditions.checkNotNull(clock);
  }

  @Nonnull
  @Override
  public StatusOr<User> createUser(User user) {
    if (user == null) {
      return StatusOr.ofStatus(Status.invalidArgument("user is required"));
    }
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      Status conflict = findConflict(user, 0L);
      if (conflict.isError()) {
        return StatusOr.ofStatus(conflict);
      }
      User stored = user.withUserId(nextId++);
      usersById.put(stored.userId(), stored);
      Logger.debug("Created user {} with id {}.", stored.username(), stored.userId());
      return StatusOr.ofValue(stored);
    } finally {
      writeLock.unlock();
    }
  }

  @Nonnull
  @Override
  public StatusOr<Optional<User>> getUserByUsername(String username) {
    return findPreferringActive(u -> u.username().equals(username));
  }

  @Nonnull
  @Override
  public StatusOr<Optional<User>> getUserByEmail(String email) {
    return findPreferringActive(u -> u.email().equals(email));
  }

  @Nonnull
  @Override
  public StatusOr<Optional<User>> getUserById(long userId) {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return StatusOr.ofValue(Optional.ofNullable(usersById.get(userId)));
    } finally {
      readLock.unlock();
    }
  }

  @Nonnull
  @Override
  public Status updateUser(User user) {
    if (user == null) {
      return Status.invalidArgument("user is required");
    }
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      return replace(user);
    } finally {
      writeLock.unlock();
    }
  }

  @Nonnull
  @Override
  public Status updateRole(long userId, Roles role, Instant updatedAt) {
    if (role == null) {
      return Status.invalidArgument("role is required");
    }
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      return replaceRole(userId, role, updatedAt);
    } finally {
      writeLock.unlock();
    }
  }

  @Nonnull
  @Override
  public Status updateRoleRetainingSuperAdmin(long userId, Roles role, Instant updatedAt) {
    if (role == null) {
      return Status.invalidArgument("role is required");
    }
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      if (countActive(Roles.SUPER_ADMIN) <= 1) {
        return Status.of(ErrorKind.LAST_SUPER_ADMIN, "cannot remove the last super admin");
      }
      return replaceRole(userId, role, updatedAt);
    } finally {
      writeLock.unlock();
    }
  }

  @Nonnull
  @Override
  public Status deleteUser(long userId) {
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      User existing = usersById.get(userId);
      if (existing == null) {
        return Status.notFound("user not found");
      }
      usersById.put(userId, existing.withActive(false, clock.instant()));
      return Status.ok();
    } finally {
      writeLock.unlock();
    }
  }

  @Nonnull
  @Override
  public StatusOr<List<User>> listUsersByRole(Roles role) {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return StatusOr.ofValue(
          usersById.values().stream()
              .filter(u -> u.active() && u.role() == role)
              .sorted(Comparator.comparingLong(User::userId))
              .collect(ImmutableList.toImmutableList()));
    } finally {
      readLock.unlock();
    }
  }

  @Nonnull
  @Override
  public StatusOr<Integer> countUsersByRole(Roles role) {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return StatusOr.ofValue(countActive(role));
    } finally {
      readLock.unlock();
    }
  }

  // Callers hold the write lock.
  private Status replace(User user) {
    if (!usersById.containsKey(user.userId())) {
      return Status.notFound("user not found");
    }
    if (user.active()) {
      Status conflict = findConflict(user, user.userId());
      if (conflict.isError()) {
        return conflict;
      }
    }
    usersById.put(user.userId(), user);
    return Status.ok();
  }

  // Callers hold the write lock.
  private Status replaceRole(long userId, Roles role, Instant updatedAt) {
    User existing = usersById.get(userId);
    if (existing == null) {
      return Status.notFound("user not found");
    }
    usersById.put(userId, existing.withRole(role, updatedAt));
    return Status.ok();
  }

  // Callers hold a lock.
  private Status findConflict(User candidate, long ignoredId) {
    boolean emailTaken = false;
    for (User existing : usersById.values()) {
      if (!existing.active() || existing.userId() == ignoredId) {
        continue;
      }
      if (existing.username().equals(candidate.username())) {
        return Status.alreadyExists("username already exists");
      }
      emailTaken |= existing.email().equals(candidate.email());
    }
    return emailTaken ? Status.alreadyExists("email already exists") : Status.ok();
  }

  // Callers hold a lock.
  private int countActive(Roles role) {
    int count = 0;
    for (User u : usersById.values()) {
      if (u.active() && u.role() == role) {
        count++;
      }
    }
    return count;
  }

  private StatusOr<Optional<User>> findPreferringActive(Predicate<User> matcher) {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return StatusOr.ofValue(
          usersById.values().stream()
              .filter(matcher)
              .max(
                  Comparator.comparing(User::active)
                      .thenComparingLong(User::userId)));
    } finally {
      readLock.unlock();
    }
  }
}
