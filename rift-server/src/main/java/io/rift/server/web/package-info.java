/**
 * HTTP endpoints and servlet filters.
 *
 * <p>Requests pass {@link io.rift.server.web.RateLimitFilter} first; webhook calls then
 * pass {@link io.rift.server.web.WebhookSecretFilter}. Errors become
 * {@link io.rift.server.api.ErrorResponse} bodies through
 * {@link io.rift.server.web.GlobalExceptionHandler}.
 */
package io.rift.server.web;
