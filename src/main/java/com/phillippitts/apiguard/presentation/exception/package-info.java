/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.apiguard.exception.CircuitOpenException} → 503 Service Unavailable
 *       (with {@code Retry-After})</li>
 *   <li>{@link com.phillippitts.apiguard.exception.RateLimitExceededException} → 429 Too Many Requests</li>
 *   <li>{@link com.phillippitts.apiguard.exception.BudgetExceededException} → 402 Payment Required</li>
 *   <li>{@link IllegalArgumentException} → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "CircuitOpenException",
 *   "message": "Service temporarily unavailable, try later",
 *   "details": "Service 'openai' is failing; retry in 27 seconds",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.apiguard.presentation.exception;
