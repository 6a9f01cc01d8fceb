@NullMarked
package io.carelink.a2a.server.tasks;

import org.jspecify.annotations.NullMarked;
