@NullMarked
package io.carelink.a2a.server.agentexecution;

import org.jspecify.annotations.NullMarked;
