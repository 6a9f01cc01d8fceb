/**
 * A small HTTP client abstraction used for outbound calls to other agents, with the JDK
 * {@code java.net.http} client as its default implementation.
 */
@NullMarked
package io.carelink.a2a.client.http;

import org.jspecify.annotations.NullMarked;
