package tech.regionguard.failover.state;

import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.EngineState;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.WorkflowExecutionRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state document shared by the in-memory and file stores. Not thread-safe; stores guard it.
 */
class StateSnapshot {

    public EngineState engineState;
    public List<HealthVerdict> verdicts = new ArrayList<>();
    public Map<String, CutoverExecution> executions = new LinkedHashMap<>();
    public Map<String, WorkflowExecutionRecord> workflows = new LinkedHashMap<>();

    Optional<EngineState> engineState() {
        return Optional.ofNullable(engineState);
    }

    List<CutoverExecution> executionsNewestFirst() {
        return executions.values().stream()
            .sorted(Comparator.comparing(CutoverExecution::startedAt).reversed())
            .toList();
    }

    int purgeTerminal(Instant executionCutoff, Instant workflowCutoff) {
        int before = executions.size() + workflows.size();
        executions.values().removeIf(e -> e.isTerminal()
            && e.completedAt() != null
            && e.completedAt().isBefore(executionCutoff));
        workflows.values().removeIf(w -> w.status().isTerminal()
            && w.updatedAt().isBefore(workflowCutoff));
        return before - executions.size() - workflows.size();
    }
}
