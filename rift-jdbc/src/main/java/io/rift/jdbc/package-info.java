/**
 * JDBC implementations of the rift SPIs.
 *
 * <ul>
 *   <li>{@link io.rift.jdbc.store} - event stores for H2, MySQL and PostgreSQL,
 *       discovered through {@link java.util.ServiceLoader}</li>
 *   <li>{@link io.rift.jdbc.purge} - retention purgers</li>
 *   <li>{@link io.rift.jdbc.rules} - rule table loading from the {@code rules} table</li>
 *   <li>{@link io.rift.jdbc.tx} - manual transaction management without Spring</li>
 * </ul>
 *
 * <p>DDL for each database ships on the classpath as {@code schema/<name>.sql};
 * the default reward rules as {@code seed/<name>.sql}.
 */
package io.rift.jdbc;
