/**
 * In-memory reward rule tables.
 */
package io.rift.rules;
