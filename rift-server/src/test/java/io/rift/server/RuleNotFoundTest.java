package io.rift.server;

import io.rift.server.web.WebhookSecretFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:rift_partial_rules;DB_CLOSE_DELAY=-1",
        "rift.server.webhook-secret=" + RuleNotFoundTest.SECRET,
        "rift.rules.source=PROPERTIES",
        "rift.rules.table[call_dial].gold=10",
        "rift.rules.table[call_dial].xp=5"
})
@AutoConfigureMockMvc
class RuleNotFoundTest {
    static final String SECRET = "partial-rules-secret-0123456789ab";

    @Autowired
    private MockMvc mvc;

    @Test
    void typeWithoutRuleIsRejectedWithItsName() throws Exception {
        mvc.perform(post("/webhook/ingest")
                        .header(WebhookSecretFilter.HEADER, SECRET)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"nooks\",\"event_type\":\"meeting_attended\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("RULE_NOT_FOUND"))
                .andExpect(jsonPath("$.detail").value("No reward rule configured for event type: meeting_attended"));
    }

    @Test
    void configuredTypeStillIngests() throws Exception {
        mvc.perform(post("/webhook/ingest")
                        .header(WebhookSecretFilter.HEADER, SECRET)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"nooks\",\"event_type\":\"call_dial\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.gold_earned").value(10));
    }
}
