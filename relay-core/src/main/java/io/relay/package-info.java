/**
 * Entry point for assembling a telemetry relay.
 *
 * <p>{@link io.relay.RelayConfig} holds validated settings; {@link io.relay.Relay} wires the
 * production ledger, the persistent publisher and the polling coordinator together and owns
 * their lifecycle.
 *
 * @see io.relay.Relay
 * @see io.relay.RelayConfig
 */
package io.relay;
