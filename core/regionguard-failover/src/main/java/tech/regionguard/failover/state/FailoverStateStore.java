package tech.regionguard.failover.state;

import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.EngineState;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.WorkflowExecutionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of the orchestrator: engine mode, last verdicts, plan executions and workflow records.
 * All methods throw {@link StateStoreException} when the backend cannot be read or written.
 */
public interface FailoverStateStore {

    Optional<EngineState> loadEngineState();

    void saveEngineState(EngineState state);

    List<HealthVerdict> loadVerdicts();

    void saveVerdicts(List<HealthVerdict> verdicts);

    void saveExecution(CutoverExecution execution);

    Optional<CutoverExecution> findExecution(String planId);

    /**
     * All retained executions, newest first.
     */
    List<CutoverExecution> listExecutions();

    void saveWorkflow(WorkflowExecutionRecord record);

    Optional<WorkflowExecutionRecord> findWorkflow(String workflowId);

    List<WorkflowExecutionRecord> listWorkflows();

    /**
     * Drop terminal executions completed before {@code executionCutoff} and terminal
     * workflow records last updated before {@code workflowCutoff}.
     *
     * @return number of entries removed
     */
    int purgeTerminal(Instant executionCutoff, Instant workflowCutoff);
}
