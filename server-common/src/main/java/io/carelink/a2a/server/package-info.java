@NullMarked
package io.carelink.a2a.server;

import org.jspecify.annotations.NullMarked;
