package io.rift.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.rift.micrometer.MicrometerMetricsExporter;
import io.rift.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code rift.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link RiftAutoConfiguration} so the exporter reaches the
 * {@link io.rift.Rift} composite. The composite closes it, which removes the meters.
 */
@AutoConfiguration(before = RiftAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "rift.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RiftProperties.class)
public class RiftMicrometerAutoConfiguration {

    @Bean(destroyMethod = "")
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, RiftProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
