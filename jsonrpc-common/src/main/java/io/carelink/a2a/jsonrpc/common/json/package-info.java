@NullMarked
package io.carelink.a2a.jsonrpc.common.json;

import org.jspecify.annotations.NullMarked;
