package com.deepansh.orchestrator.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits work into lane batches.
 *
 * Lane count is min(maxLanes, ceil(n / perLane)). Items are spread as evenly
 * as possible; the first (n % lanes) batches get one extra item. Order is
 * preserved within and across batches.
 */
public final class ChunkBatchPartitioner {

    private ChunkBatchPartitioner() {
    }

    public static int laneCount(int items, int maxLanes, int perLane) {
        if (maxLanes < 1 || perLane < 1) {
            throw new IllegalArgumentException("maxLanes and perLane must be >= 1");
        }
        if (items <= 0) return 0;
        int needed = (items + perLane - 1) / perLane;
        return Math.min(maxLanes, needed);
    }

    public static <T> List<List<T>> partition(List<T> items, int maxLanes, int perLane) {
        int lanes = laneCount(items.size(), maxLanes, perLane);
        List<List<T>> batches = new ArrayList<>(lanes);
        if (lanes == 0) return batches;

        int base = items.size() / lanes;
        int remainder = items.size() % lanes;
        int from = 0;
        for (int lane = 0; lane < lanes; lane++) {
            int size = base + (lane < remainder ? 1 : 0);
            batches.add(new ArrayList<>(items.subList(from, from + size)));
            from += size;
        }
        return batches;
    }
}
