/**
 * Spring Boot auto-configuration for the telemetry relay.
 *
 * @see io.relay.spring.boot.RelayAutoConfiguration
 * @see io.relay.spring.boot.RelayProperties
 */
package io.relay.spring.boot;
