package com.deepansh.orchestrator.filter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkBatchPartitionerTest {

    @Test
    void laneCount_isCappedByMaxLanes() {
        assertThat(ChunkBatchPartitioner.laneCount(10, 3, 3)).isEqualTo(3);
        assertThat(ChunkBatchPartitioner.laneCount(4, 3, 3)).isEqualTo(2);
        assertThat(ChunkBatchPartitioner.laneCount(1, 3, 3)).isEqualTo(1);
        assertThat(ChunkBatchPartitioner.laneCount(0, 3, 3)).isZero();
    }

    @Test
    void laneCount_invalidLimits_throws() {
        assertThatThrownBy(() -> ChunkBatchPartitioner.laneCount(5, 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void partition_tenItemsThreeLanes_spreadsRemainderOverFirstBatches() {
        List<Integer> items = List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);

        List<List<Integer>> batches = ChunkBatchPartitioner.partition(items, 3, 3);

        assertThat(batches).containsExactly(
                List.of(0, 1, 2, 3),
                List.of(4, 5, 6),
                List.of(7, 8, 9));
    }

    @Test
    void partition_fourItems_usesTwoLanes() {
        List<List<String>> batches = ChunkBatchPartitioner.partition(List.of("a", "b", "c", "d"), 3, 3);

        assertThat(batches).containsExactly(List.of("a", "b"), List.of("c", "d"));
    }

    @Test
    void partition_empty_returnsNoBatches() {
        assertThat(ChunkBatchPartitioner.partition(List.of(), 3, 3)).isEmpty();
    }
}
