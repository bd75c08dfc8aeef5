package io.rift.spring.boot;

import io.rift.EventIngestor;
import io.rift.EventType;
import io.rift.IncomingEvent;
import io.rift.IngestResult;
import io.rift.Reward;
import io.rift.Rift;
import io.rift.Rule;
import io.rift.jdbc.DataSourceConnectionProvider;
import io.rift.jdbc.store.AbstractJdbcEventStore;
import io.rift.jdbc.store.H2EventStore;
import io.rift.rules.StaticRuleTable;
import io.rift.spi.ConnectionProvider;
import io.rift.spi.RuleTable;
import io.rift.spi.TxContext;
import io.rift.spring.SpringTxContext;
import io.rift.stats.StatsAggregator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RiftAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    DataSourceTransactionManagerAutoConfiguration.class,
                    SqlInitializationAutoConfiguration.class,
                    RiftAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.generate-unique-name=true",
                    "spring.sql.init.schema-locations=classpath:schema/h2.sql",
                    "spring.sql.init.data-locations=classpath:seed/h2.sql");

    @Test
    void createsAllBeans() {
        runner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertInstanceOf(H2EventStore.class, ctx.getBean(AbstractJdbcEventStore.class));
            assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
            assertInstanceOf(SpringTxContext.class, ctx.getBean(TxContext.class));
            assertNotNull(ctx.getBean(RuleTable.class));
            Rift rift = ctx.getBean(Rift.class);
            assertSame(rift.ingestor(), ctx.getBean(EventIngestor.class));
            assertSame(rift.stats(), ctx.getBean(StatsAggregator.class));
            assertNull(rift.purgeScheduler());
        });
    }

    @Test
    void rulesAreLoadedFromSeededTable() {
        runner.withPropertyValues("rift.rules.strict=true").run(ctx -> {
            RuleTable rules = ctx.getBean(RuleTable.class);
            assertTrue(rules.missingTypes().isEmpty());
            assertEquals(new Reward(200, 100), rules.resolve(EventType.MEETING_BOOKED));
        });
    }

    @Test
    void strictModeFailsOnIncompleteRules() {
        runner.withPropertyValues(
                "rift.rules.source=PROPERTIES",
                "rift.rules.table[email_sent].gold=10",
                "rift.rules.table[email_sent].xp=3",
                "rift.rules.strict=true").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            assertInstanceOf(IllegalStateException.class, rootCause(ctx.getStartupFailure()));
        });
    }

    @Test
    void lenientModeStartsWithPartialRules() {
        runner.withPropertyValues(
                "rift.rules.source=PROPERTIES",
                "rift.rules.table[call_dial].gold=7",
                "rift.rules.table[call_dial].xp=2").run(ctx -> {
            assertNull(ctx.getStartupFailure());
            RuleTable rules = ctx.getBean(RuleTable.class);
            assertEquals(new Reward(7, 2), rules.resolve(EventType.CALL_DIAL));
            assertEquals(4, rules.missingTypes().size());
        });
    }

    @Test
    void propertiesRuleSourceWithDashedKeys() {
        runner.withPropertyValues(
                "rift.rules.source=PROPERTIES",
                "rift.rules.table.meeting-booked.gold=300",
                "rift.rules.table.meeting-booked.xp=150",
                "rift.rules.table.meeting-booked.display-name=Meeting Booked").run(ctx -> {
            Rule rule = ctx.getBean(RuleTable.class).find(EventType.MEETING_BOOKED).orElseThrow();
            assertEquals(new Reward(300, 150), rule.reward());
            assertEquals("Meeting Booked", rule.displayName());
        });
    }

    @Test
    void purgeSchedulerWhenEnabled() {
        runner.withPropertyValues("rift.purge.enabled=true", "rift.purge.retention=P30D").run(ctx -> {
            Rift rift = ctx.getBean(Rift.class);
            assertNotNull(rift.purgeScheduler());
            assertEquals(Duration.ofDays(30), rift.purgeScheduler().retention());
        });
    }

    @Test
    void ingestJoinsSpringTransaction() {
        runner.run(ctx -> {
            EventIngestor ingestor = ctx.getBean(EventIngestor.class);
            TransactionTemplate tx = new TransactionTemplate(ctx.getBean(PlatformTransactionManager.class));
            IncomingEvent event = IncomingEvent.fromWire("outreach", "call_connect", Map.of("call_id", "a"), null);

            IngestResult first = tx.execute(status -> ingestor.ingest(event));
            IngestResult second = tx.execute(status -> ingestor.ingest(event));

            assertNotNull(first);
            assertFalse(first.isDuplicate());
            assertEquals(new Reward(25, 15), first.reward());
            assertNotNull(second);
            assertTrue(second.isDuplicate());
            assertEquals(1, ctx.getBean(StatsAggregator.class).currentStats().callsConnected());
        });
    }

    @Test
    void backsOffForUserRuleTable() {
        runner.withUserConfiguration(CustomRulesConfig.class).run(ctx -> {
            assertSame(CustomRulesConfig.TABLE, ctx.getBean(RuleTable.class));
        });
    }

    private static Throwable rootCause(Throwable t) {
        Throwable current = t;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Configuration
    static class CustomRulesConfig {
        static final StaticRuleTable TABLE = StaticRuleTable.of(Rule.of(EventType.EMAIL_SENT, 1, 1));

        @Bean
        RuleTable customRuleTable() {
            return TABLE;
        }
    }
}
