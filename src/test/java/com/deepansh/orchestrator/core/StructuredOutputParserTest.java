package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.RecognizedEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.deepansh.orchestrator.stream.ResponseSections.ANSWER_MARKER;
import static com.deepansh.orchestrator.stream.ResponseSections.THINKING_MARKER;
import static org.assertj.core.api.Assertions.assertThat;

class StructuredOutputParserTest {

    private final StructuredOutputParser parser = new StructuredOutputParser(new ObjectMapper(), "research-general");

    @Test
    void parseIntent_quickResponse_shortCircuits() {
        IntentVerdict verdict = parser.parseIntent(
                "{\"is_quick_response\": true, \"standard_answer\": \"Hello!\", \"workflow_categories\": []}");

        assertThat(verdict.shortCircuits()).isTrue();
        assertThat(verdict.standardAnswer()).isEqualTo("Hello!");
        assertThat(verdict.categories()).isEmpty();
    }

    @Test
    void parseIntent_fencedJsonAfterAnswerMarker_isParsed() {
        String output = THINKING_MARKER + "classifying" + ANSWER_MARKER + """
                ```json
                {"is_quick_response": false, "workflow_categories": ["technical-troubleshooting", "equipment-maintenance"]}
                ```""";

        IntentVerdict verdict = parser.parseIntent(output);

        assertThat(verdict.shortCircuits()).isFalse();
        assertThat(verdict.categories()).containsExactly("technical-troubleshooting", "equipment-maintenance");
    }

    @Test
    void parseIntent_missingCategories_usesDefaultCategory() {
        IntentVerdict verdict = parser.parseIntent("{\"is_quick_response\": false}");

        assertThat(verdict.categories()).containsExactly("research-general");
    }

    @Test
    void parseIntent_singleStringCategory_isWrapped() {
        IntentVerdict verdict = parser.parseIntent("{\"workflow_categories\": \"fault-analysis\"}");

        assertThat(verdict.categories()).containsExactly("fault-analysis");
    }

    @Test
    void parseIntent_quickWithoutAnswer_doesNotShortCircuit() {
        IntentVerdict verdict = parser.parseIntent("{\"is_quick_response\": true, \"standard_answer\": \" \"}");

        assertThat(verdict.shortCircuits()).isFalse();
    }

    @Test
    void parseIntent_malformed_fallsBack() {
        assertThat(parser.parseIntent("not json at all")).isEqualTo(IntentVerdict.fallback());
        assertThat(parser.parseIntent("[1, 2]")).isEqualTo(IntentVerdict.fallback());
    }

    @Test
    void parseEntities_singleObject_becomesOneEntity() {
        List<RecognizedEntity> entities = parser.parseEntities(
                "{\"device_name\": \"Pump-7\", \"device_type\": \"pump\", \"fault_type\": \"vibration\"}");

        assertThat(entities).hasSize(1);
        assertThat(entities.get(0).getDeviceName()).isEqualTo("Pump-7");
        assertThat(entities.get(0).getFaultType()).isEqualTo("vibration");
    }

    @Test
    void parseEntities_arraySkipsNonObjects() {
        List<RecognizedEntity> entities = parser.parseEntities(
                "[{\"device_name\": \"A\"}, \"noise\", {\"device_name\": \"B\", \"extra\": 1}]");

        assertThat(entities).extracting(RecognizedEntity::getDeviceName).containsExactly("A", "B");
    }

    @Test
    void parseEntities_malformed_returnsEmpty() {
        assertThat(parser.parseEntities("{broken")).isEmpty();
    }

    @Test
    void extractJson_plainText_isStripped() {
        assertThat(StructuredOutputParser.extractJson("  {\"a\":1}  ")).isEqualTo("{\"a\":1}");
        assertThat(StructuredOutputParser.extractJson("```\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
    }
}
