@NullMarked
package io.carelink.a2a.client.transport.jsonrpc.sse;

import org.jspecify.annotations.NullMarked;
