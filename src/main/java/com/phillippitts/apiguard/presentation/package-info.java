/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP boundary of the application. Presentation depends on
 * service but not vice versa; the governance core runs without it.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - dashboard endpoints exporting governance state</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.apiguard.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.apiguard.presentation;
