package io.rift.spring.boot;

import io.rift.EventIngestor;
import io.rift.EventType;
import io.rift.Reward;
import io.rift.Rift;
import io.rift.Rule;
import io.rift.jdbc.DataSourceConnectionProvider;
import io.rift.jdbc.purge.JdbcEventPurgers;
import io.rift.jdbc.rules.JdbcRuleLoader;
import io.rift.jdbc.store.AbstractJdbcEventStore;
import io.rift.jdbc.store.JdbcEventStores;
import io.rift.rules.StaticRuleTable;
import io.rift.spi.ConnectionProvider;
import io.rift.spi.MetricsExporter;
import io.rift.spi.RuleTable;
import io.rift.spi.TxContext;
import io.rift.spring.SpringTxContext;
import io.rift.stats.StatsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Auto-configuration for rift.
 *
 * <p>Wires a {@link Rift} composite from a {@link DataSource} and
 * {@link RiftProperties}. The event store is detected from the JDBC URL and
 * ingestion joins Spring-managed transactions through {@link SpringTxContext}.
 *
 * @see RiftProperties
 * @see RiftMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Rift.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RiftProperties.class)
public class RiftAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(RiftAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcEventStore eventStore(DataSource dataSource) {
        return JdbcEventStores.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(TxContext.class)
    public SpringTxContext txContext(DataSource dataSource) {
        return new SpringTxContext(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(RuleTable.class)
    @DependsOnDatabaseInitialization
    public RuleTable ruleTable(RiftProperties props, ConnectionProvider connectionProvider) {
        RiftProperties.Rules rules = props.getRules();
        StaticRuleTable table = switch (rules.getSource()) {
            case JDBC -> new JdbcRuleLoader(connectionProvider).load();
            case PROPERTIES -> fromProperties(rules.getTable());
        };
        if (rules.isStrict()) {
            return table.requireComplete();
        }
        Set<EventType> missing = table.missingTypes();
        if (!missing.isEmpty()) {
            log.warn("No reward rule for {}; these events will be rejected", missing);
        }
        return table;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Rift rift(RiftProperties props,
                     ConnectionProvider connectionProvider,
                     TxContext txContext,
                     AbstractJdbcEventStore eventStore,
                     RuleTable ruleTable,
                     ObjectProvider<MetricsExporter> metricsProvider) {
        var builder = Rift.builder()
                .connectionProvider(connectionProvider)
                .txContext(txContext)
                .eventStore(eventStore)
                .ruleTable(ruleTable)
                .duplicateWindow(props.getDuplicateWindow())
                .statsZone(props.getStats().resolvedZone());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        if (props.getPurge().isEnabled()) {
            builder.purger(JdbcEventPurgers.forDatabase(eventStore.name()))
                    .purgeRetention(props.getPurge().getRetention())
                    .purgeBatchSize(props.getPurge().getBatchSize())
                    .purgeIntervalSeconds(props.getPurge().getIntervalSeconds());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventIngestor eventIngestor(Rift rift) {
        return rift.ingestor();
    }

    @Bean
    @ConditionalOnMissingBean
    public StatsAggregator statsAggregator(Rift rift) {
        return rift.stats();
    }

    static StaticRuleTable fromProperties(Map<String, RiftProperties.RuleEntry> entries) {
        List<Rule> rules = new ArrayList<>(entries.size());
        entries.forEach((key, entry) -> {
            // relaxed binding may hand us "call-dial" for call_dial
            EventType type = EventType.fromWire(key.toLowerCase(Locale.ROOT).replace('-', '_'));
            rules.add(new Rule(type, new Reward(entry.getGold(), entry.getXp()),
                    entry.getDisplayName(), entry.getDescription()));
        });
        return StaticRuleTable.of(rules);
    }
}
