/**
 * Three-state circuit breaker used to stop hammering failing devices and sinks.
 *
 * @see io.relay.breaker.CircuitBreaker
 * @see io.relay.breaker.BreakerSettings
 */
package io.relay.breaker;
