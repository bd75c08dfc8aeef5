/**
 * Spring transaction integration.
 *
 * <p>{@link io.rift.spring.SpringTxContext} lets {@link io.rift.EventIngestor} join
 * Spring-managed transactions, e.g. a {@code @Transactional} webhook handler.
 */
package io.rift.spring;
