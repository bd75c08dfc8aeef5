/**
 * Root API: admission of sales activity events with rewards, duplicate
 * suppression and derived statistics.
 *
 * <h2>Core Design</h2>
 * <p>Events are written within the caller's transaction via
 * {@link io.rift.EventIngestor}. An event that repeats one admitted in the last
 * few minutes (same source, type and canonical metadata) is acknowledged as a
 * duplicate and not stored. Every admitted event copies its reward from the
 * {@linkplain io.rift.spi.RuleTable rule table} at admission time and gets one
 * audit-log entry in the same transaction.
 *
 * <p>{@linkplain io.rift.stats.StatsAggregator Stats} are recomputed from the
 * event log on each read: totals, a level derived from XP and a rank derived
 * from meetings booked.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>rift-core</b>: domain types, ingestion, stats, SPIs</li>
 *   <li><b>rift-jdbc</b>: event stores and purgers for H2, MySQL and PostgreSQL</li>
 *   <li><b>rift-spring-adapter</b>: Spring transaction bridge</li>
 *   <li><b>rift-micrometer</b>: Micrometer metrics bridge</li>
 *   <li><b>rift-spring-boot-starter</b>: auto-configuration</li>
 *   <li><b>rift-server</b>: webhook, stats and health endpoints</li>
 * </ul>
 *
 * @see io.rift.Rift
 * @see io.rift.EventIngestor
 */
package io.rift;
