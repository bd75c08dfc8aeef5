package io.rift.server;

import io.rift.EventStoreException;
import io.rift.PoolExhaustedException;
import io.rift.server.api.IngestRequest;
import io.rift.server.service.IngestService;
import io.rift.server.web.WebhookSecretFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:rift_errors;DB_CLOSE_DELAY=-1",
        "rift.server.webhook-secret=" + ErrorMappingTest.SECRET
})
@AutoConfigureMockMvc
class ErrorMappingTest {
    static final String SECRET = "error-mapping-secret-0123456789ab";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private IngestService ingestService;

    private static MockHttpServletRequestBuilder dial() {
        return post("/webhook/ingest")
                .header(WebhookSecretFilter.HEADER, SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"outreach\",\"event_type\":\"call_dial\"}");
    }

    @Test
    void poolExhaustionIsReported() throws Exception {
        when(ingestService.ingest(any(IngestRequest.class)))
                .thenThrow(new PoolExhaustedException("Connection pool exhausted", new SQLTransientConnectionException()));

        mvc.perform(dial())
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("POOL_EXHAUSTED"));
    }

    @Test
    void transactionThatCannotStartOnTimeoutIsPoolExhaustion() throws Exception {
        when(ingestService.ingest(any(IngestRequest.class)))
                .thenThrow(new CannotCreateTransactionException("Could not open JDBC Connection",
                        new SQLTransientConnectionException("rift-pool - Connection is not available")));

        mvc.perform(dial())
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("POOL_EXHAUSTED"));
    }

    @Test
    void storeFailureIsReportedWithoutInternals() throws Exception {
        when(ingestService.ingest(any(IngestRequest.class)))
                .thenThrow(new EventStoreException("Failed to insert event", new SQLException("disk full")));

        mvc.perform(dial())
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("STORE_ERROR"))
                .andExpect(jsonPath("$.detail").value("Failed to access event store"));
    }

    @Test
    void springDataAccessFailureIsStoreError() throws Exception {
        when(ingestService.ingest(any(IngestRequest.class)))
                .thenThrow(new CannotGetJdbcConnectionException("down", new SQLException("refused")));

        mvc.perform(dial())
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("STORE_ERROR"));
    }
}
