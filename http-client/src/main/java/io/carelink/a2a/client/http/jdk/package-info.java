@NullMarked
package io.carelink.a2a.client.http.jdk;

import org.jspecify.annotations.NullMarked;
