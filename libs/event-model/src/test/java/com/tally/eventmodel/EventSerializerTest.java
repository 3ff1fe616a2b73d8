package com.tally.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventSerializer")
class EventSerializerTest {

    private static final String INVOICE_PAID =
            """
            {
              "id": "evt_1",
              "type": "invoice.paid",
              "created": 1767225600,
              "data": {
                "object": {
                  "amount_paid": 4900,
                  "metadata": { "tenant_id": "t-1", "tier_id": "pro" }
                }
              }
            }
            """;

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("reads id, type and epoch-second created timestamp")
        void identifyingFields() {
            ExternalEvent event = EventSerializer.parse(INVOICE_PAID);

            assertThat(event.eventId()).isEqualTo("evt_1");
            assertThat(event.eventType()).isEqualTo("invoice.paid");
            assertThat(event.createdAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        }

        @Test
        @DisplayName("exposes the data object as payload and its metadata")
        void payloadAndMetadata() {
            ExternalEvent event = EventSerializer.parse(INVOICE_PAID);

            assertThat(event.payload()).containsEntry("amount_paid", 4900);
            assertThat(event.tenantId()).contains("t-1");
            assertThat(event.metadataValue("tier_id")).contains("pro");
        }

        @Test
        @DisplayName("data-object metadata wins over top-level metadata")
        void metadataPrecedence() {
            ExternalEvent event =
                    EventSerializer.parse(
                            """
                            {"id":"evt_2","type":"x","metadata":{"tenant_id":"outer","k":"v"},
                             "data":{"object":{"metadata":{"tenant_id":"inner"}}}}
                            """);

            assertThat(event.tenantId()).contains("inner");
            assertThat(event.metadata()).containsEntry("k", "v");
        }

        @Test
        @DisplayName("missing optional sections leave empty values")
        void minimalEvent() {
            ExternalEvent event = EventSerializer.parse("{\"id\":\"evt_3\",\"type\":\"ping\"}");

            assertThat(event.createdAt()).isNull();
            assertThat(event.payload()).isEmpty();
            assertThat(event.tenantId()).isEmpty();
        }

        @Test
        @DisplayName("ISO-8601 created values are accepted")
        void isoCreated() {
            ExternalEvent event =
                    EventSerializer.parse(
                            "{\"id\":\"e\",\"type\":\"t\",\"created\":\"2026-03-01T10:00:00Z\"}");

            assertThat(event.createdAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
        }

        @Test
        @DisplayName("malformed JSON throws EventSerializationException")
        void malformed() {
            assertThatThrownBy(() -> EventSerializer.parse("{not json"))
                    .isInstanceOf(EventSerializer.EventSerializationException.class);
            assertThatThrownBy(() -> EventSerializer.parse("[1,2]"))
                    .isInstanceOf(EventSerializer.EventSerializationException.class)
                    .hasMessageContaining("JSON object");
        }

        @Test
        @DisplayName("tryParse returns empty instead of throwing")
        void tryParse() {
            assertThat(EventSerializer.tryParse("nope")).isEmpty();
            assertThat(EventSerializer.tryParse(INVOICE_PAID)).isPresent();
        }
    }

    @Test
    @DisplayName("serialize() writes Instants as ISO-8601 strings")
    void serializeIso() {
        var event =
                new ExternalEvent(
                        "evt_9", "invoice.paid", Instant.parse("2026-01-01T00:00:00Z"), Map.of(), Map.of());

        assertThat(EventSerializer.serialize(event))
                .contains("\"eventId\":\"evt_9\"")
                .containsPattern("\"createdAt\"\\s*:\\s*\"2026-01-01T");
    }
}
