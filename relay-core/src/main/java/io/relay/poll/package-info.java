/**
 * Periodic concurrent polling of configured devices.
 *
 * @see io.relay.poll.PollingCoordinator
 * @see io.relay.poll.CycleResult
 */
package io.relay.poll;
