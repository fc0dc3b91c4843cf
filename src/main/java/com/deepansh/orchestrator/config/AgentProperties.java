package com.deepansh.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Strongly-typed configuration for the orchestration core.
 * Bound from application.yml under the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Upper bound on reason-loop turns per branch. */
    private int maxIterations = 10;

    /** Shared wall-clock deadline for all branches of one fan-out. */
    private Duration branchTimeout = Duration.ofSeconds(3600);

    /** Category whose template is used when entity extraction fails. */
    private String defaultCategory = "research-general";

    /** Known workflow categories, keyed by id (e.g. technical-troubleshooting). */
    private Map<String, Category> categories = new LinkedHashMap<>();

    private Filter filter = new Filter();

    private Runs runs = new Runs();

    public Optional<Category> category(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(categories.get(id));
    }

    public boolean isKnownCategory(String id) {
        return id != null && categories.containsKey(id);
    }

    @Data
    public static class Category {
        /** Tool whitelist; empty means every listed tool is permitted. */
        private List<String> tools = new ArrayList<>();
        private String template = "";
    }

    @Data
    public static class Filter {
        private int maxLanes = 3;
        private int chunksPerLane = 3;
        private String positiveKeyword = "RELEVANT";
        private String negativeKeyword = "IRRELEVANT";
        private int relevantDefaultScore = 80;
        private int irrelevantDefaultScore = 20;
        /** Score given to a chunk whose judgement failed; such chunks are kept. */
        private int fallbackScore = 50;
    }

    @Data
    public static class Runs {
        /** Wall-clock limit for one run; the sweep fails runs that exceed it. */
        private Duration timeout = Duration.ofMinutes(30);
        /** Finished runs stay queryable this long. */
        private Duration retention = Duration.ofHours(24);
    }
}
