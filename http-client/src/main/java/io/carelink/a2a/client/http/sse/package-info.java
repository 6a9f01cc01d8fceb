@NullMarked
package io.carelink.a2a.client.http.sse;

import org.jspecify.annotations.NullMarked;
