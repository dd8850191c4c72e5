package tech.regionguard.failover.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jboss.logging.Logger;
import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.EngineState;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.WorkflowExecutionRecord;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * State kept in one JSON document on disk. Every write replaces the document through a
 * temporary file and an atomic move, so a crash leaves either the old or the new state.
 */
public class FileFailoverStateStore implements FailoverStateStore {

    private static final Logger LOG = Logger.getLogger(FileFailoverStateStore.class);

    static final String STATE_FILE = "failover-state.json";

    private final Path stateFile;
    private final Path tempFile;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private StateSnapshot snapshot;

    public FileFailoverStateStore(Path directory) {
        this.stateFile = directory.resolve(STATE_FILE);
        this.tempFile = directory.resolve(STATE_FILE + ".tmp");
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StateStoreException("Cannot create state directory " + directory, e);
        }
        this.snapshot = readSnapshot();
        LOG.infof("File state store at %s (engine state %s)", stateFile,
            snapshot.engineState == null ? "absent" : snapshot.engineState.mode());
    }

    @Override
    public Optional<EngineState> loadEngineState() {
        return read(StateSnapshot::engineState);
    }

    @Override
    public void saveEngineState(EngineState state) {
        write(s -> s.engineState = state);
    }

    @Override
    public List<HealthVerdict> loadVerdicts() {
        return read(s -> List.copyOf(s.verdicts));
    }

    @Override
    public void saveVerdicts(List<HealthVerdict> verdicts) {
        write(s -> s.verdicts = List.copyOf(verdicts));
    }

    @Override
    public void saveExecution(CutoverExecution execution) {
        write(s -> s.executions.put(execution.planId(), execution));
    }

    @Override
    public Optional<CutoverExecution> findExecution(String planId) {
        return read(s -> Optional.ofNullable(s.executions.get(planId)));
    }

    @Override
    public List<CutoverExecution> listExecutions() {
        return read(StateSnapshot::executionsNewestFirst);
    }

    @Override
    public void saveWorkflow(WorkflowExecutionRecord record) {
        write(s -> s.workflows.put(record.workflowId(), record));
    }

    @Override
    public Optional<WorkflowExecutionRecord> findWorkflow(String workflowId) {
        return read(s -> Optional.ofNullable(s.workflows.get(workflowId)));
    }

    @Override
    public List<WorkflowExecutionRecord> listWorkflows() {
        return read(s -> List.copyOf(s.workflows.values()));
    }

    @Override
    public int purgeTerminal(Instant executionCutoff, Instant workflowCutoff) {
        lock.lock();
        try {
            int removed = snapshot.purgeTerminal(executionCutoff, workflowCutoff);
            if (removed > 0) {
                persist();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Function<StateSnapshot, T> reader) {
        lock.lock();
        try {
            return reader.apply(snapshot);
        } finally {
            lock.unlock();
        }
    }

    private void write(Consumer<StateSnapshot> mutation) {
        lock.lock();
        try {
            mutation.accept(snapshot);
            persist();
        } finally {
            lock.unlock();
        }
    }

    private StateSnapshot readSnapshot() {
        try {
            if (Files.exists(stateFile) && Files.size(stateFile) > 0) {
                return objectMapper.readValue(stateFile.toFile(), StateSnapshot.class);
            }
            return new StateSnapshot();
        } catch (IOException e) {
            throw new StateStoreException("Error while reading failover state from " + stateFile, e);
        }
    }

    private void persist() {
        try {
            objectMapper.writeValue(tempFile.toFile(), snapshot);
            try {
                Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            // Reload so memory does not run ahead of what is on disk
            snapshot = readSnapshot();
            throw new StateStoreException("Error while writing failover state to " + stateFile, e);
        }
    }
}
