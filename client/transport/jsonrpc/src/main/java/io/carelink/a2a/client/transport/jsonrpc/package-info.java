@NullMarked
package io.carelink.a2a.client.transport.jsonrpc;

import org.jspecify.annotations.NullMarked;
