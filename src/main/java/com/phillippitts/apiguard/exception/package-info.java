/**
 * Governance exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.apiguard.exception.ApiGuardException} and are
 * unchecked. They are raised at the call site and handled by the immediate caller; the core
 * never swallows them.
 *
 * <ul>
 *   <li>{@link com.phillippitts.apiguard.exception.CircuitOpenException} - breaker rejected the
 *       call (maps to HTTP 503)</li>
 *   <li>{@link com.phillippitts.apiguard.exception.RateLimitExceededException} - limiter is not
 *       allowed to wait and a cap was hit (maps to HTTP 429)</li>
 *   <li>{@link com.phillippitts.apiguard.exception.BudgetExceededException} - enforced budget
 *       ceiling crossed; hard stop for the scope (maps to HTTP 402)</li>
 * </ul>
 *
 * @see com.phillippitts.apiguard.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.apiguard.exception;
