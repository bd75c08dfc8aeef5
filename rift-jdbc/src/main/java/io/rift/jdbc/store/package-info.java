/**
 * JDBC event stores: a standard-SQL base class with H2, MySQL and PostgreSQL
 * variants, registered for {@link java.util.ServiceLoader} discovery.
 *
 * @see io.rift.jdbc.store.JdbcEventStores
 */
package io.rift.jdbc.store;
