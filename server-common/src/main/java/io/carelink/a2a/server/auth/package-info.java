@NullMarked
package io.carelink.a2a.server.auth;

import org.jspecify.annotations.NullMarked;
