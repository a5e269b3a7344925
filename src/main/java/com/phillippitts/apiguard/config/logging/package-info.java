/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code method}, {@code uri} - the request being served</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.apiguard.config.logging.MdcFilter
 */
package com.phillippitts.apiguard.config.logging;
