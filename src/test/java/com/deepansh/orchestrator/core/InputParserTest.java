package com.deepansh.orchestrator.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InputParserTest {

    private final InputParser parser = new InputParser(new ObjectMapper(), ZoneOffset.UTC);

    @Test
    void parse_plainText_isTheQuery() {
        ParsedInput parsed = parser.parse("How do I reset the pump controller?");

        assertThat(parsed.query()).isEqualTo("How do I reset the pump controller?");
        assertThat(parsed.metadata()).isEmpty();
        assertThat(parsed.attachments()).isEmpty();
    }

    @Test
    void parse_brokenJson_fallsBackToPlainText() {
        ParsedInput parsed = parser.parse("{not really json");

        assertThat(parsed.query()).isEqualTo("{not really json");
    }

    @Test
    void parse_genericForm_readsInputMetadataAndAttachments() {
        ParsedInput parsed = parser.parse("""
                {"input": "why is Pump-7 vibrating", "metadata": {"site": "north", "dev_name": "Pump-7"},
                 "attachments": [{"name": "log.txt"}]}
                """);

        assertThat(parsed.query()).isEqualTo("why is Pump-7 vibrating");
        assertThat(parsed.metadata()).containsEntry("site", "north").containsEntry("dev_name", "Pump-7");
        assertThat(parsed.attachments()).containsExactly(Map.of("name", "log.txt"));
    }

    @Test
    void parse_queryForm_needsMetadataOrAttachments() {
        ParsedInput parsed = parser.parse("{\"query\": \"inspect breaker\", \"metadata\": {\"unit\": 3}}");

        assertThat(parsed.query()).isEqualTo("inspect breaker");
        assertThat(parsed.metadata()).containsEntry("unit", 3);
    }

    @Test
    void parse_legacyEvent_mapsFieldsAndFormatsEpochSeconds() {
        ParsedInput parsed = parser.parse("""
                {"faultDescr": "transformer over-temperature", "occurTime": "1700000000",
                 "faultId": "F-1", "devId": "D-9", "devName": ""}
                """);

        assertThat(parsed.query()).isEqualTo("transformer over-temperature");
        assertThat(parsed.metadata())
                .containsEntry("event_time", "2023-11-14 22:13:20")
                .containsEntry("event_id", "F-1")
                .containsEntry("source_device_id", "D-9")
                .doesNotContainKey("source_device_name");
    }

    @Test
    void formatEventTime_handlesMillisFormattedAndUnknownValues() {
        assertThat(parser.formatEventTime("1700000000000")).isEqualTo("2023-11-14 22:13:20");
        assertThat(parser.formatEventTime("2024-01-02 03:04:05")).isEqualTo("2024-01-02 03:04:05");
        assertThat(parser.formatEventTime("yesterday")).isEqualTo("yesterday");
        assertThat(parser.formatEventTime(null)).isEmpty();
    }

    @Test
    void parse_jsonArray_isPlainText() {
        ParsedInput parsed = parser.parse("[1, 2]");

        assertThat(parsed.query()).isEqualTo("[1, 2]");
        assertThat(parsed.attachments()).isEqualTo(List.of());
    }
}
