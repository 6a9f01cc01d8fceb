/**
 * An agent that fulfils a request by calling other agents in a fixed order.
 */
@NullMarked
package io.carelink.a2a.coordinator;

import org.jspecify.annotations.NullMarked;
