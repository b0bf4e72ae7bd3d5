/**
 * OpenTelemetry tracing for the pattern compiler.
 *
 * <p>Spans are captured at two levels:</p>
 * <ol>
 *   <li>Solver calls (compile, export, solve) with variable and clause
 *       counts</li>
 *   <li>Fact-store backend calls with the statement sent to the store</li>
 * </ol>
 *
 * <p>Traces are exported via OTLP protocol to a collector such as Jaeger.</p>
 *
 * @see com.falkordb.cyphersat.tracing.TracingUtil
 */
package com.falkordb.cyphersat.tracing;
