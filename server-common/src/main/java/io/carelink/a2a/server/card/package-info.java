@NullMarked
package io.carelink.a2a.server.card;

import org.jspecify.annotations.NullMarked;
