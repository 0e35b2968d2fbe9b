package com.chimerapool.common.status;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Tests for Status and StatusOr. */
class StatusTest {

  @Test
  void testStatusCreation() {
    Status ok = Status.ok();
    assertTrue(ok.isOk());
    assertFalse(ok.isError());
    assertEquals(StatusCode.OK, ok.getCode());
    assertNull(ok.getKind());

    Status notFound = Status.notFound("user not found");
    assertTrue(notFound.isError());
    assertEquals(StatusCode.NOT_FOUND, notFound.getCode());
    assertTrue(notFound.is(ErrorKind.USER_NOT_FOUND));
    assertEquals("user not found", notFound.getMessage());
    assertEquals(404, notFound.getHttpCode());

    Exception exception = new RuntimeException("connection reset");
    Status internal = Status.internal("Failed to load user", exception);
    assertEquals(StatusCode.INTERNAL, internal.getCode());
    assertEquals("Failed to load user", internal.getMessage());
    assertSame(exception, internal.getCause());
  }

  @Test
  void testKindsMapToHttpCodes() {
    assertEquals(400, Status.of(ErrorKind.VALIDATION, "x").getHttpCode());
    assertEquals(401, Status.of(ErrorKind.INVALID_CREDENTIALS, "x").getHttpCode());
    assertEquals(401, Status.of(ErrorKind.TOKEN_EXPIRED, "x").getHttpCode());
    assertEquals(403, Status.of(ErrorKind.PERMISSION_DENIED, "x").getHttpCode());
    assertEquals(403, Status.of(ErrorKind.ACCOUNT_DISABLED, "x").getHttpCode());
    assertEquals(404, Status.of(ErrorKind.USER_NOT_FOUND, "x").getHttpCode());
    assertEquals(409, Status.of(ErrorKind.ALREADY_EXISTS, "x").getHttpCode());
    assertEquals(500, Status.of(ErrorKind.INTERNAL, "x").getHttpCode());
  }

  @Test
  void testSharedCodesKeepDistinctKinds() {
    Status self = Status.of(ErrorKind.CANNOT_MODIFY_SELF, "cannot modify your own role");
    Status last = Status.of(ErrorKind.LAST_SUPER_ADMIN, "cannot remove the last super admin");

    assertEquals(self.getCode(), last.getCode());
    assertNotEquals(self, last);
    assertTrue(self.is(ErrorKind.CANNOT_MODIFY_SELF));
    assertFalse(self.is(ErrorKind.LAST_SUPER_ADMIN));
  }

  @Test
  void testTokenErrorKinds() {
    assertTrue(ErrorKind.TOKEN_EMPTY.isTokenError());
    assertTrue(ErrorKind.TOKEN_MALFORMED.isTokenError());
    assertTrue(ErrorKind.TOKEN_EXPIRED.isTokenError());
    assertFalse(ErrorKind.INVALID_CREDENTIALS.isTokenError());
  }

  @Test
  void testStatusOrWithValue() {
    StatusOr<String> statusOr = StatusOr.ofValue("alice");
    assertTrue(statusOr.isOk());
    assertFalse(statusOr.isNotOk());
    assertEquals("alice", statusOr.getValue());
    assertTrue(statusOr.getStatus().isOk());
    assertTrue(statusOr.toString().contains("alice"));
  }

  @Test
  void testStatusOrWithError() {
    Status error = Status.invalidArgument("username is required");
    StatusOr<String> statusOr = StatusOr.ofStatus(error);
    assertTrue(statusOr.isNotOk());
    assertEquals(error, statusOr.getStatus());
    assertThrows(IllegalStateException.class, statusOr::getValue);
  }

  @Test
  void testStatusOrOfStatusRejectsOk() {
    assertThrows(IllegalArgumentException.class, () -> StatusOr.ofStatus(Status.ok()));
  }

  @Test
  void testStatusOrFromExceptionKeepsCallerMessage() {
    Exception exception = new IllegalStateException("secret=hunter2");
    StatusOr<String> statusOr = StatusOr.ofException("failed to hash password", exception);

    assertTrue(statusOr.getStatus().is(ErrorKind.INTERNAL));
    assertEquals("failed to hash password", statusOr.getStatus().getMessage());
    assertSame(exception, statusOr.getStatus().getCause());
  }

  @Test
  void testErrorAsKeepsStatus() {
    Status error = Status.notFound("user not found");
    StatusOr<String> lookup = StatusOr.ofStatus(error);

    StatusOr<Integer> retyped = lookup.errorAs();

    assertTrue(retyped.isNotOk());
    assertSame(error, retyped.getStatus());
  }

  @Test
  void testErrorAsRejectsSuccess() {
    StatusOr<String> lookup = StatusOr.ofValue("alice");

    assertThrows(IllegalStateException.class, lookup::errorAs);
  }

  @Test
  void testStatusOrOfValueRejectsNull() {
    assertThrows(NullPointerException.class, () -> StatusOr.ofValue(null));
  }
}
