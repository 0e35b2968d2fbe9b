package com.chimerapool.auth;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.chimerapool.common.status.ErrorKind;
import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.db.InMemoryUserRepository;
import com.chimerapool.db.User;
import com.chimerapool.db.UserRepository;
import com.chimerapool.security.DefaultUserImpl;
import com.chimerapool.security.Roles;
import com.chimerapool.util.TestClock;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

class RoleServiceTest {

  private static final Instant NOW = Instant.parse("2030-01-15T10:00:00Z");

  private TestClock clock;
  private InMemoryUserRepository repository;
  private RoleService roleService;

  @BeforeEach
  void setUp() {
    clock = new TestClock(NOW);
    repository = new InMemoryUserRepository(clock);
    roleService = new RoleService(repository, clock);
  }

  private User create(String username, Roles role) {
    return repository
        .createUser(
            User.newUser(username, username + "@example.com", NOW)
                .withPasswordHash("$2a$04$hash")
                .withRole(role, NOW))
        .getValue();
  }

  private Roles storedRole(User user) {
    return repository.getUserById(user.userId()).getValue().orElseThrow().role();
  }

  private static com.chimerapool.security.User actor(User user) {
    return DefaultUserImpl.of(user);
  }

  // The manage table, written out independently of Roles.canManage.
  private static boolean manages(Roles actor, Roles target) {
    return switch (actor) {
      case SUPER_ADMIN -> true;
      case ADMIN -> target == Roles.USER || target == Roles.MODERATOR;
      case MODERATOR, USER -> false;
    };
  }

  static Stream<Arguments> everyRoleCombination() {
    List<Arguments> combinations = new ArrayList<>();
    for (Roles actorRole : Roles.values()) {
      for (Roles currentRole : Roles.values()) {
        for (Roles newRole : Roles.values()) {
          combinations.add(Arguments.of(actorRole, currentRole, newRole));
        }
      }
    }
    return combinations.stream();
  }

  @ParameterizedTest(name = "{0} changes {1} to {2}")
  @MethodSource("everyRoleCombination")
  void testRoleHierarchyTable(Roles actorRole, Roles currentRole, Roles newRole) {
    // Arrange: a spare super admin keeps the last-super-admin guard out of the way
    create("reserve", Roles.SUPER_ADMIN);
    User actor = create("actor", actorRole);
    User target = create("target", currentRole);

    // Act
    Status status = roleService.changeRole(actor(actor), target.userId(), newRole);

    // Assert
    boolean allowed = manages(actorRole, currentRole) && manages(actorRole, newRole);
    if (allowed) {
      assertTrue(status.isOk(), status.toString());
      assertEquals(newRole, storedRole(target));
    } else {
      assertTrue(status.is(ErrorKind.PERMISSION_DENIED), status.toString());
      assertEquals(currentRole, storedRole(target));
    }
  }

  @Test
  void testSoleSuperAdminCannotDemoteThemselves() {
    User root = create("root", Roles.SUPER_ADMIN);

    Status status = roleService.changeRole(actor(root), root.userId(), Roles.ADMIN);

    assertTrue(status.is(ErrorKind.LAST_SUPER_ADMIN));
    assertEquals(Roles.SUPER_ADMIN, storedRole(root));
  }

  @Test
  void testSuperAdminMayStepDownWhenAnotherRemains() {
    User root = create("root", Roles.SUPER_ADMIN);
    create("root2", Roles.SUPER_ADMIN);

    Status status = roleService.changeRole(actor(root), root.userId(), Roles.ADMIN);

    assertTrue(status.isOk());
    assertEquals(Roles.ADMIN, storedRole(root));
  }

  @Test
  void testInactiveSuperAdminsDoNotCount() {
    User root = create("root", Roles.SUPER_ADMIN);
    User retired = create("retired", Roles.SUPER_ADMIN);
    repository.deleteUser(retired.userId());

    Status status = roleService.changeRole(actor(root), root.userId(), Roles.USER);

    assertTrue(status.is(ErrorKind.LAST_SUPER_ADMIN));
  }

  @Test
  void testSuperAdminCannotReassignSuperAdminToThemselves() {
    User root = create("root", Roles.SUPER_ADMIN);
    create("root2", Roles.SUPER_ADMIN);

    Status status = roleService.changeRole(actor(root), root.userId(), Roles.SUPER_ADMIN);

    assertTrue(status.is(ErrorKind.CANNOT_MODIFY_SELF));
  }

  @ParameterizedTest
  @EnumSource(
      value = Roles.class,
      names = {"USER", "MODERATOR", "ADMIN"})
  void testOtherRolesCannotModifyThemselves(Roles role) {
    User self = create("self", role);

    for (Roles newRole : Roles.values()) {
      Status status = roleService.changeRole(actor(self), self.userId(), newRole);
      assertTrue(status.is(ErrorKind.CANNOT_MODIFY_SELF), role + " -> " + newRole);
    }
    assertEquals(role, storedRole(self));
  }

  @Test
  void testAdminCannotDemoteAnotherAdmin() {
    create("root", Roles.SUPER_ADMIN);
    User admin = create("admin", Roles.ADMIN);
    User otherAdmin = create("other", Roles.ADMIN);

    Status status = roleService.changeRole(actor(admin), otherAdmin.userId(), Roles.USER);

    assertTrue(status.is(ErrorKind.PERMISSION_DENIED));
    assertEquals(Roles.ADMIN, storedRole(otherAdmin));
  }

  @Test
  void testSuperAdminDemotesAdmin() {
    User root = create("root", Roles.SUPER_ADMIN);
    User otherAdmin = create("other", Roles.ADMIN);
    clock.advance(Duration.ofMinutes(10));

    Status status = roleService.changeRole(actor(root), otherAdmin.userId(), Roles.USER);

    assertTrue(status.isOk());
    User stored = repository.getUserById(otherAdmin.userId()).getValue().orElseThrow();
    assertEquals(Roles.USER, stored.role());
    assertEquals(NOW.plus(Duration.ofMinutes(10)), stored.updatedAt());
    assertEquals(NOW, stored.createdAt());
  }

  @Test
  void testRoleChangeKeepsSoftDeleteMadeAfterLookup() {
    // A soft delete lands between the target lookup and the role write.
    AtomicBoolean deleteOnRead = new AtomicBoolean(false);
    repository =
        new InMemoryUserRepository(clock) {
          @Override
          public StatusOr<Optional<User>> getUserById(long userId) {
            StatusOr<Optional<User>> result = super.getUserById(userId);
            if (deleteOnRead.get()) {
              deleteUser(userId);
            }
            return result;
          }
        };
    User root = create("root", Roles.SUPER_ADMIN);
    User alice = create("alice", Roles.USER);
    deleteOnRead.set(true);

    Status status =
        new RoleService(repository, clock).changeRole(actor(root), alice.userId(), Roles.MODERATOR);

    deleteOnRead.set(false);
    assertTrue(status.isOk());
    User stored = repository.getUserById(alice.userId()).getValue().orElseThrow();
    assertEquals(Roles.MODERATOR, stored.role());
    assertFalse(stored.active());
    assertEquals(alice.passwordHash(), stored.passwordHash());
  }

  @Test
  void testLastSuperAdminGuardRunsBeforePermissionGuard() {
    User root = create("root", Roles.SUPER_ADMIN);
    User admin = create("admin", Roles.ADMIN);

    Status status = roleService.changeRole(actor(admin), root.userId(), Roles.USER);

    assertTrue(status.is(ErrorKind.LAST_SUPER_ADMIN));
  }

  @Test
  void testUnknownRoleIsRejectedFirst() {
    User root = create("root", Roles.SUPER_ADMIN);

    assertTrue(roleService.changeRole(actor(root), 999L, "overlord").is(ErrorKind.INVALID_ROLE));
    assertTrue(roleService.changeRole(actor(root), 999L, (Roles) null).is(ErrorKind.INVALID_ROLE));
  }

  @Test
  void testRoleStringsAreParsed() {
    User root = create("root", Roles.SUPER_ADMIN);
    User alice = create("alice", Roles.USER);

    assertTrue(roleService.changeRole(actor(root), alice.userId(), " Moderator ").isOk());
    assertEquals(Roles.MODERATOR, storedRole(alice));
    assertTrue(roleService.changeRole(actor(root), alice.userId(), "superadmin").isOk());
    assertEquals(Roles.SUPER_ADMIN, storedRole(alice));
  }

  @Test
  void testUnknownTargetIsNotFound() {
    User root = create("root", Roles.SUPER_ADMIN);

    Status status = roleService.changeRole(actor(root), 999L, Roles.ADMIN);

    assertTrue(status.is(ErrorKind.USER_NOT_FOUND));
    assertEquals("user not found", status.getMessage());
  }

  @Test
  void testInactiveTargetCanBeChanged() {
    User admin = create("admin", Roles.ADMIN);
    User alice = create("alice", Roles.USER);
    repository.deleteUser(alice.userId());

    Status status = roleService.changeRole(actor(admin), alice.userId(), Roles.MODERATOR);

    assertTrue(status.isOk());
    assertEquals(Roles.MODERATOR, storedRole(alice));
  }

  @Test
  void testWrappersDelegateToChangeRole() {
    User root = create("root", Roles.SUPER_ADMIN);
    User admin = create("admin", Roles.ADMIN);
    User alice = create("alice", Roles.USER);

    assertTrue(roleService.promoteToModerator(actor(admin), alice.userId()).isOk());
    assertEquals(Roles.MODERATOR, storedRole(alice));
    assertTrue(
        roleService.promoteToAdmin(actor(admin), alice.userId()).is(ErrorKind.PERMISSION_DENIED));
    assertTrue(roleService.promoteToAdmin(actor(root), alice.userId()).isOk());
    assertEquals(Roles.ADMIN, storedRole(alice));
    assertTrue(roleService.demoteToUser(actor(root), alice.userId()).isOk());
    assertEquals(Roles.USER, storedRole(alice));
  }

  @Test
  void testListModerators() {
    User root = create("root", Roles.SUPER_ADMIN);
    User admin = create("admin", Roles.ADMIN);
    User moderator = create("mod1", Roles.MODERATOR);
    User retired = create("mod2", Roles.MODERATOR);
    User alice = create("alice", Roles.USER);
    repository.deleteUser(retired.userId());

    StatusOr<List<User>> byAdmin = roleService.listModerators(actor(admin));
    StatusOr<List<User>> byRoot = roleService.listModerators(actor(root));

    assertEquals(
        List.of(moderator.userId()), byAdmin.getValue().stream().map(User::userId).toList());
    assertEquals(byAdmin.getValue(), byRoot.getValue());
    assertTrue(
        roleService
            .listModerators(actor(moderator))
            .getStatus()
            .is(ErrorKind.PERMISSION_DENIED));
    assertTrue(
        roleService.listModerators(actor(alice)).getStatus().is(ErrorKind.PERMISSION_DENIED));
  }

  @Test
  void testListAdminsIncludesSuperAdmins() {
    User root = create("root", Roles.SUPER_ADMIN);
    User admin = create("admin", Roles.ADMIN);
    User root2 = create("root2", Roles.SUPER_ADMIN);
    create("mod", Roles.MODERATOR);

    StatusOr<List<User>> admins = roleService.listAdmins(actor(root));

    assertEquals(
        List.of(root.userId(), admin.userId(), root2.userId()),
        admins.getValue().stream().map(User::userId).toList());
    assertTrue(roleService.listAdmins(actor(admin)).getStatus().is(ErrorKind.PERMISSION_DENIED));
  }

  @Test
  void testConcurrentMutualDemotionKeepsOneSuperAdmin() throws Exception {
    User root1 = create("root1", Roles.SUPER_ADMIN);
    User root2 = create("root2", Roles.SUPER_ADMIN);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      Future<Status> first =
          executor.submit(
              () -> {
                start.await();
                return roleService.changeRole(actor(root1), root2.userId(), Roles.USER);
              });
      Future<Status> second =
          executor.submit(
              () -> {
                start.await();
                return roleService.changeRole(actor(root2), root1.userId(), Roles.USER);
              });
      start.countDown();

      Status a = first.get(10, TimeUnit.SECONDS);
      Status b = second.get(10, TimeUnit.SECONDS);

      assertTrue(a.isOk() ^ b.isOk(), a + " / " + b);
      assertTrue((a.isOk() ? b : a).is(ErrorKind.LAST_SUPER_ADMIN));
      assertEquals(1, repository.countUsersByRole(Roles.SUPER_ADMIN).getValue());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testRepositoryFailureIsSurfacedWithoutWriting() {
    UserRepository failing = mock(UserRepository.class);
    User root = create("root", Roles.SUPER_ADMIN);
    User other = create("other", Roles.SUPER_ADMIN);
    when(failing.getUserById(other.userId())).thenReturn(StatusOr.ofValue(Optional.of(other)));
    when(failing.countUsersByRole(Roles.SUPER_ADMIN))
        .thenReturn(
            StatusOr.ofStatus(
                Status.internal("Failed to count users", new SQLException("timeout"))));

    Status status =
        new RoleService(failing, clock).changeRole(actor(root), other.userId(), Roles.ADMIN);

    assertTrue(status.is(ErrorKind.INTERNAL));
    verify(failing, never()).updateRole(anyLong(), any(), any());
    verify(failing, never()).updateRoleRetainingSuperAdmin(anyLong(), any(), any());
  }

  @Test
  void testNoWriteWhenNothingIsAllowed() {
    UserRepository repositoryMock = mock(UserRepository.class);
    User moderator = create("mod", Roles.MODERATOR);
    User alice = create("alice", Roles.USER);
    when(repositoryMock.getUserById(alice.userId()))
        .thenReturn(StatusOr.ofValue(Optional.of(alice)));

    RoleService service = new RoleService(repositoryMock, clock);

    for (Roles newRole : EnumSet.allOf(Roles.class)) {
      Status status = service.changeRole(actor(moderator), alice.userId(), newRole);
      assertTrue(status.is(ErrorKind.PERMISSION_DENIED));
    }
    verify(repositoryMock, never()).updateRole(anyLong(), any(), any());
  }
}
