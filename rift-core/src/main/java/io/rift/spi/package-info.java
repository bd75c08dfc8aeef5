/**
 * Service provider interfaces: transaction and connection access, event
 * persistence, reward rules, purging and metrics export.
 *
 * <p>JDBC implementations live in {@code rift-jdbc}; the Spring transaction
 * bridge lives in {@code rift-spring-adapter}.
 */
package io.rift.spi;
