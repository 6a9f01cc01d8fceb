@NullMarked
package io.carelink.a2a.server.streaming;

import org.jspecify.annotations.NullMarked;
