/**
 * Thread-bound JDBC transactions for use without Spring.
 */
package io.rift.jdbc.tx;
