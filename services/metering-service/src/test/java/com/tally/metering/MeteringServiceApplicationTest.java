package com.tally.metering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import com.tally.metering.config.ServiceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Full-context tests on the 'test' profile, which keeps all state in memory and needs no
 * external infrastructure.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Metering Service Application")
class MeteringServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    private String createTenant(String owner) throws Exception {
        String body =
                mockMvc.perform(
                                post("/api/v1/tenants")
                                        .header("X-User-ID", owner)
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content("{\"name\":\"Acme\",\"tier\":\"free\"}"))
                        .andExpect(status().isCreated())
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        return JsonPath.read(body, "$.id");
    }

    @Nested
    @DisplayName("Infrastructure")
    class Infrastructure {

        @Test
        @DisplayName("service properties are loaded from the test profile")
        void serviceProperties() {
            var props = context.getBean(ServiceProperties.class);
            assertThat(props.name()).isEqualTo("metering-service-test");
            assertThat(props.environment()).isEqualTo("test");
        }

        @Test
        @DisplayName("info endpoint reports the service and its storage")
        void info() throws Exception {
            mockMvc.perform(get("/api/v1/info"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("metering-service-test"))
                    .andExpect(jsonPath("$.storage").value("memory"))
                    .andExpect(jsonPath("$.status").value("running"));
        }

        @Test
        @DisplayName("actuator health is available")
        void health() throws Exception {
            mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
        }

        @Test
        @DisplayName("responses carry a correlation ID")
        void correlationId() throws Exception {
            mockMvc.perform(get("/api/v1/info"))
                    .andExpect(status().isOk())
                    .andExpect(
                            result -> assertThat(result.getResponse().getHeader("X-Correlation-ID")).isNotBlank());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("a request without a user is rejected with 401")
        void unauthenticated() throws Exception {
            mockMvc.perform(get("/api/v1/tenants/t-none/usage/counters"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.type").value("https://tally.dev/errors/unauthorized"));
        }

        @Test
        @DisplayName("a non-member is denied with 403")
        void nonMember() throws Exception {
            String tenantId = createTenant("owner-1");

            mockMvc.perform(get("/api/v1/tenants/{id}/usage/counters", tenantId).header("X-User-ID", "stranger"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("a claim for another tenant is rejected")
        void tenantMismatch() throws Exception {
            String tenantId = createTenant("owner-2");

            mockMvc.perform(
                            get("/api/v1/tenants/{id}/usage/counters", tenantId)
                                    .header("X-User-ID", "owner-2")
                                    .header("X-Tenant-ID", "someone-else"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.title").value("Tenant Mismatch"));
        }

        @Test
        @DisplayName("the owner cannot be removed")
        void ownerRemoval() throws Exception {
            String tenantId = createTenant("owner-3");

            mockMvc.perform(
                            delete("/api/v1/tenants/{id}/members/{user}", tenantId, "owner-3")
                                    .header("X-User-ID", "owner-3"))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("negative usage is a validation error")
        void negativeUsage() throws Exception {
            String tenantId = createTenant("owner-4");

            mockMvc.perform(
                            post("/api/v1/tenants/{id}/usage", tenantId)
                                    .header("X-User-ID", "owner-4")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"sessions\":-1}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("a malformed webhook body is a bad request")
        void malformedWebhook() throws Exception {
            mockMvc.perform(
                            post("/api/v1/webhooks/billing")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{not json"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Test
    @DisplayName("usage flows through limits, alerts, the audit ledger and billing")
    void endToEnd() throws Exception {
        String tenantId = createTenant("alice");

        String usage =
                mockMvc.perform(
                                post("/api/v1/tenants/{id}/usage", tenantId)
                                        .header("X-User-ID", "alice")
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content(
                                                "{\"sessions\":17,\"tokensInput\":400,\"tokensOutput\":100,"
                                                        + "\"costCents\":12,\"sessionType\":\"chat\"}"))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.counters.hourlySessions").value(17))
                        .andExpect(jsonPath("$.counters.monthlyTokens").value(500))
                        .andExpect(jsonPath("$.alertsRaised", hasSize(1)))
                        .andExpect(jsonPath("$.alertsRaised[0].alertType").value("HOURLY_SESSIONS_WARNING"))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        String alertId = JsonPath.read(usage, "$.alertsRaised[0].id");
        String auditEntryId = JsonPath.read(usage, "$.auditEntryId");

        mockMvc.perform(get("/api/v1/tenants/{id}/limits", tenantId).header("X-User-ID", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.metric == 'HOURLY_SESSIONS')].isWarning").value(true));

        mockMvc.perform(
                        put("/api/v1/tenants/{id}/rate-limits", tenantId)
                                .header("X-User-ID", "alice")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"sessionsPerHour\":200}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionsPerHour").value(200));

        mockMvc.perform(post("/api/v1/tenants/{id}/alerts/{alert}/acknowledge", tenantId, alertId).header("X-User-ID", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledgedBy").value("alice"));

        mockMvc.perform(
                        get("/api/v1/tenants/{id}/audit/{entry}/verification", tenantId, auditEntryId)
                                .header("X-User-ID", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));

        String event =
                "{\"id\":\"evt_e2e_" + tenantId + "\",\"type\":\"checkout.session.completed\",\"created\":1760000000,"
                        + "\"data\":{\"object\":{\"metadata\":{\"tenant_id\":\"" + tenantId + "\",\"tier_id\":\"pro\"}}}}";
        mockMvc.perform(post("/api/v1/webhooks/billing").contentType(MediaType.APPLICATION_JSON).content(event))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alreadyProcessed").value(false));
        mockMvc.perform(post("/api/v1/webhooks/billing").contentType(MediaType.APPLICATION_JSON).content(event))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alreadyProcessed").value(true));

        mockMvc.perform(get("/api/v1/tenants/{id}", tenantId).header("X-User-ID", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("pro"));

        mockMvc.perform(get("/api/v1/tenants/{id}/audit/verification", tenantId).header("X-User-ID", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intact").value(true))
                .andExpect(jsonPath("$.invalid").value(0));
    }
}
