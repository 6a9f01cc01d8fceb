@NullMarked
package io.carelink.a2a.server.util;

import org.jspecify.annotations.NullMarked;
