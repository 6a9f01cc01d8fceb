@NullMarked
package io.carelink.a2a.client.http.jdk.sse;

import org.jspecify.annotations.NullMarked;
