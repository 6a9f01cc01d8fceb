@NullMarked
package io.carelink.a2a.server.config;

import org.jspecify.annotations.NullMarked;
