/**
 * Contains classes for error handling and status reporting.
 *
 * <p>This package provides a consistent way to represent operation outcomes without relying on
 * exceptions for control flow. The central classes are:
 *
 * <ul>
 *   <li>{@link com.chimerapool.common.status.StatusCode} - Enum of transport-level codes, aligned
 *       with gRPC and HTTP status codes</li>
 *   <li>{@link com.chimerapool.common.status.ErrorKind} - The closed set of failures this core
 *       reports (validation, duplicate, bad credentials, token, permission, role guards)</li>
 *   <li>{@link com.chimerapool.common.status.Status} - A code and kind with an optional message
 *       and cause</li>
 *   <li>{@link com.chimerapool.common.status.StatusOr} - Container that holds either a
 *       successful value or an error status</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;LoginResult&gt; result = authService.login(username, password);
 * if (result.isOk()) {
 *     String token = result.getValue().token();
 *     // ...
 * } else if (result.getStatus().is(ErrorKind.ACCOUNT_DISABLED)) {
 *     // Tell the user the account was disabled by an administrator.
 * } else {
 *     int httpCode = result.getStatus().getHttpCode();
 *     // ...
 * }
 * </pre>
 */
package com.chimerapool.common.status;
