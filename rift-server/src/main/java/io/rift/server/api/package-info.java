/**
 * JSON request and response bodies. Property names are snake_case on the wire.
 */
package io.rift.server.api;
