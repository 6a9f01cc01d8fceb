@NullMarked
package io.carelink.a2a.server.util.async;

import org.jspecify.annotations.NullMarked;
