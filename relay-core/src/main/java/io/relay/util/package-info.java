/**
 * Internal helpers.
 */
package io.relay.util;
