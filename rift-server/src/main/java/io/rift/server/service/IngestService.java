package io.rift.server.service;

import io.rift.EventIngestor;
import io.rift.IncomingEvent;
import io.rift.IngestResult;
import io.rift.server.api.IngestRequest;
import io.rift.spi.TxContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional boundary around {@link EventIngestor}. The event row and its
 * audit entry commit together or not at all.
 */
@Service
public class IngestService {
    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final EventIngestor ingestor;
    private final TxContext txContext;
    private final StatsService statsService;

    public IngestService(EventIngestor ingestor, TxContext txContext, StatsService statsService) {
        this.ingestor = ingestor;
        this.txContext = txContext;
        this.statsService = statsService;
    }

    /**
     * @throws io.rift.InvalidEventException for an unknown source or type, bad metadata,
     *     or a type without a reward rule
     */
    @Transactional
    public IngestResult ingest(IngestRequest request) {
        IncomingEvent event = IncomingEvent.fromWire(
                request.source(), request.eventType(), request.metadata(), request.timestamp());
        IngestResult result = ingestor.ingest(event);
        if (result.isDuplicate()) {
            log.debug("Duplicate {} from {} ignored", event.eventType().wireName(), event.source().wireName());
        } else {
            log.debug("Stored {} from {} as {} (+{} gold, +{} xp)", event.eventType().wireName(),
                    event.source().wireName(), result.eventId(), result.reward().gold(), result.reward().xp());
            txContext.afterCommit(statsService::invalidate);
        }
        return result;
    }
}
