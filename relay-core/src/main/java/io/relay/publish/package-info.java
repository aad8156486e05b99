/**
 * Bounded outbound queue and the background publisher that drains it to a sink.
 *
 * @see io.relay.publish.PersistentPublisher
 * @see io.relay.publish.OutboundQueue
 * @see io.relay.publish.Envelope
 */
package io.relay.publish;
