/**
 * Spring Boot auto-configuration for rift.
 *
 * <p>{@link io.rift.spring.boot.RiftAutoConfiguration} wires a {@link io.rift.Rift}
 * instance from {@code rift.*} application properties and exposes its
 * {@link io.rift.EventIngestor} and {@link io.rift.stats.StatsAggregator} as beans.
 *
 * @see io.rift.spring.boot.RiftAutoConfiguration
 * @see io.rift.spring.boot.RiftProperties
 */
package io.rift.spring.boot;
