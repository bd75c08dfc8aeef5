/**
 * Shared utilities: canonical JSON encoding, hashing and thread naming.
 */
package io.rift.util;
