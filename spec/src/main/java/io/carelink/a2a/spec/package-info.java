/**
 * Protocol data model: messages and parts, tasks and their states, agent cards, and the
 * errors carried by response envelopes. All types serialize with Jackson and are immutable.
 */
@NullMarked
package io.carelink.a2a.spec;

import org.jspecify.annotations.NullMarked;
