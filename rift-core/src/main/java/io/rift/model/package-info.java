/**
 * Value types exchanged between the core and event store implementations.
 */
package io.rift.model;
