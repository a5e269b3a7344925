/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /api/metrics} - full metrics snapshot with system health</li>
 *   <li>{@code GET /api/metrics/cost-history?period=hourly|daily&count=N} - dense cost series</li>
 *   <li>{@code GET /api/circuit-breakers}, {@code GET /api/rate-limits}, {@code GET /api/budgets}</li>
 *   <li>{@code POST /api/circuit-breakers/{name}/reset|force-open} - operational overrides</li>
 * </ul>
 */
package com.phillippitts.apiguard.presentation.controller;
