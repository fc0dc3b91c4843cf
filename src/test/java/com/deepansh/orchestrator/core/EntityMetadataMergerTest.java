package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.RecognizedEntity;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EntityMetadataMergerTest {

    private final EntityMetadataMerger merger = new EntityMetadataMerger();

    @Test
    void merge_callerValueWinsOverEntity() {
        Map<String, Object> metadata = Map.of("dev_name", "Pump-7");
        List<RecognizedEntity> entities = List.of(RecognizedEntity.builder()
                .deviceName("Pump-3").faultType("leak").build());

        Map<String, Object> merged = merger.merge(metadata, entities);

        assertThat(merged).containsEntry("dev_name", "Pump-7").containsEntry("fault_type1", "leak");
    }

    @Test
    void merge_nullLiteralDeviceName_isReplaced() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("dev_name", "null");
        metadata.put("fault_type1", "");

        Map<String, Object> merged = merger.merge(metadata, List.of(RecognizedEntity.builder()
                .deviceName("Pump-3").faultType("overheat").build()));

        assertThat(merged).containsEntry("dev_name", "Pump-3").containsEntry("fault_type1", "overheat");
    }

    @Test
    void merge_nullDeviceName_isReplaced() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("dev_name", null);

        Map<String, Object> merged = merger.merge(metadata, List.of(RecognizedEntity.builder()
                .deviceName("Pump-7").build()));

        assertThat(merged).containsEntry("dev_name", "Pump-7");
    }

    @Test
    void merge_firstEntityFillsMissingFields() {
        Map<String, Object> merged = merger.merge(Map.of(), List.of(
                RecognizedEntity.builder().deviceName("T1").build(),
                RecognizedEntity.builder().deviceName("T2").faultType("trip").build()));

        assertThat(merged).containsEntry("dev_name", "T1").containsEntry("fault_type1", "trip");
    }

    @Test
    void merge_summarisesEveryEntity() {
        Map<String, Object> merged = merger.merge(Map.of(), List.of(RecognizedEntity.builder()
                .deviceName("Pump-7").deviceType("pump").faultType("vibration").voltageLevel("10kV").build()));

        assertThat(merged.get("recognized_entities")).isEqualTo(List.of(
                "device name: Pump-7, device type: pump, fault type: vibration, voltage level: 10kV"));
    }

    @Test
    void merge_noEntities_returnsCopyOfInput() {
        Map<String, Object> metadata = Map.of("site", "north");

        Map<String, Object> merged = merger.merge(metadata, List.of());

        assertThat(merged).isEqualTo(metadata).isNotSameAs(metadata);
        assertThat(merged).doesNotContainKey("recognized_entities");
    }
}
