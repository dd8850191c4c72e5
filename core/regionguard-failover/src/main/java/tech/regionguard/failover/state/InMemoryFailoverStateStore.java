package tech.regionguard.failover.state;

import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.EngineState;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.WorkflowExecutionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Process-local state. Mode survives nothing; for tests and local development.
 */
public class InMemoryFailoverStateStore implements FailoverStateStore {

    private final StateSnapshot snapshot = new StateSnapshot();

    @Override
    public synchronized Optional<EngineState> loadEngineState() {
        return snapshot.engineState();
    }

    @Override
    public synchronized void saveEngineState(EngineState state) {
        snapshot.engineState = state;
    }

    @Override
    public synchronized List<HealthVerdict> loadVerdicts() {
        return List.copyOf(snapshot.verdicts);
    }

    @Override
    public synchronized void saveVerdicts(List<HealthVerdict> verdicts) {
        snapshot.verdicts = List.copyOf(verdicts);
    }

    @Override
    public synchronized void saveExecution(CutoverExecution execution) {
        snapshot.executions.put(execution.planId(), execution);
    }

    @Override
    public synchronized Optional<CutoverExecution> findExecution(String planId) {
        return Optional.ofNullable(snapshot.executions.get(planId));
    }

    @Override
    public synchronized List<CutoverExecution> listExecutions() {
        return snapshot.executionsNewestFirst();
    }

    @Override
    public synchronized void saveWorkflow(WorkflowExecutionRecord record) {
        snapshot.workflows.put(record.workflowId(), record);
    }

    @Override
    public synchronized Optional<WorkflowExecutionRecord> findWorkflow(String workflowId) {
        return Optional.ofNullable(snapshot.workflows.get(workflowId));
    }

    @Override
    public synchronized List<WorkflowExecutionRecord> listWorkflows() {
        return List.copyOf(snapshot.workflows.values());
    }

    @Override
    public synchronized int purgeTerminal(Instant executionCutoff, Instant workflowCutoff) {
        return snapshot.purgeTerminal(executionCutoff, workflowCutoff);
    }
}
