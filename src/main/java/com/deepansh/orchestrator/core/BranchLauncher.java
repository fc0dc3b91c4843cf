package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.WorkflowResult;

import java.util.List;
import java.util.Map;

/**
 * Runs one isolated engine branch per category and returns their results
 * keyed by category, in the order the categories were given.
 */
@FunctionalInterface
public interface BranchLauncher {

    Map<String, WorkflowResult> launch(SessionContext base, List<String> categories);
}
