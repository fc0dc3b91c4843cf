package com.deepansh.orchestrator.run;

import com.deepansh.orchestrator.config.AgentProperties;
import com.deepansh.orchestrator.model.AgentRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-process index of runs by id, for status queries and cancellation.
 *
 * A periodic sweep fails runs that outlive their deadline and forgets
 * finished runs once they are older than the retention window.
 */
@Component
@Slf4j
public class RunRegistry {

    private static final int INPUT_PREVIEW = 200;

    private final AgentProperties.Runs settings;
    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();

    public RunRegistry(AgentProperties properties) {
        this.settings = properties.getRuns();
    }

    public RunHandle create(AgentRequest request) {
        Instant now = Instant.now();
        String userId = request.getUserId() != null ? request.getUserId() : "default";
        RunHandle handle = new RunHandle(UUID.randomUUID().toString(), request.getSessionId(), userId,
                preview(request.getInput()), now, now.plus(settings.getTimeout()));
        runs.put(handle.getRunId(), handle);
        log.debug("Run registered [runId={}, userId={}]", handle.getRunId(), userId);
        return handle;
    }

    public Optional<RunHandle> get(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /** Newest first; a null userId lists every user's runs. */
    public List<RunHandle> list(String userId, int limit) {
        return runs.values().stream()
                .filter(run -> userId == null || userId.equals(run.getUserId()))
                .sorted(Comparator.comparing(RunHandle::getCreatedAt).reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    public int size() {
        return runs.size();
    }

    @Scheduled(fixedDelayString = "${agent.runs.sweep-interval-ms:60000}")
    public void sweep() {
        sweep(Instant.now());
    }

    void sweep(Instant now) {
        int expired = 0;
        int evicted = 0;
        Instant cutoff = now.minus(settings.getRetention());
        for (RunHandle run : runs.values()) {
            if (!run.getStatus().isTerminal()) {
                if (run.expire(now)) expired++;
            } else if (run.getCreatedAt().isBefore(cutoff)) {
                runs.remove(run.getRunId());
                evicted++;
            }
        }
        if (expired > 0 || evicted > 0) {
            log.info("Run sweep [timedOut={}, evicted={}, tracked={}]", expired, evicted, runs.size());
        }
    }

    private static String preview(String input) {
        if (input == null) return "";
        return input.length() <= INPUT_PREVIEW ? input : input.substring(0, INPUT_PREVIEW) + "...";
    }
}
