/**
 * Presentation layer (REST control API and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - {@code /api/sync} endpoints delegating to the
 *       sync engine and manager</li>
 *   <li>{@code presentation.exception} - maps sync exceptions to HTTP status codes</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; all status rules live in the service layer.
 *
 * @see com.phillippitts.n8nsync.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.n8nsync.presentation;
