package io.rift.server.web;

import io.rift.server.api.IngestRequest;
import io.rift.server.api.IngestResponse;
import io.rift.server.service.IngestService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhook")
public class WebhookController {

    private final IngestService ingestService;

    public WebhookController(IngestService ingestService) {
        this.ingestService = ingestService;
    }

    /**
     * Accepts one sales-activity event. Duplicates also answer 201 so senders
     * stop retrying.
     */
    @PostMapping("/ingest")
    @ResponseStatus(HttpStatus.CREATED)
    public IngestResponse ingest(@Valid @RequestBody IngestRequest request) {
        return IngestResponse.from(ingestService.ingest(request));
    }
}
