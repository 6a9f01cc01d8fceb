@NullMarked
package io.carelink.a2a.server.http;

import org.jspecify.annotations.NullMarked;
