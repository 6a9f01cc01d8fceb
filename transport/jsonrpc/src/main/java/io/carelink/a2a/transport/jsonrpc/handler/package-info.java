/**
 * JSON-RPC 2.0 handling of the A2A message methods, independent of the HTTP server.
 *
 * @see io.carelink.a2a.transport.jsonrpc.handler.JSONRPCHandler
 */
@NullMarked
package io.carelink.a2a.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;
