@NullMarked
package io.carelink.a2a.server.requesthandlers;

import org.jspecify.annotations.NullMarked;
