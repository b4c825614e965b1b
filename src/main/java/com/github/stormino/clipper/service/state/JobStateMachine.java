package com.github.stormino.clipper.service.state;

import com.github.stormino.clipper.model.Job;
import com.github.stormino.clipper.model.JobStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for job status transitions.
 *
 * Valid state flow:
 * <pre>
 * QUEUED → WORKING → DONE
 *    ↓        ↓
 *  ERROR    ERROR
 * </pre>
 * DONE and ERROR are absorbing.
 */
@Component
@Slf4j
public class JobStateMachine {

    private final Map<JobStatus, Set<JobStatus>> validTransitions;
    private final Clock clock;

    public JobStateMachine() {
        this(Clock.systemUTC());
    }

    public JobStateMachine(Clock clock) {
        this.clock = clock;
        validTransitions = new EnumMap<>(JobStatus.class);
        validTransitions.put(JobStatus.QUEUED, EnumSet.of(JobStatus.WORKING, JobStatus.ERROR));
        validTransitions.put(JobStatus.WORKING, EnumSet.of(JobStatus.DONE, JobStatus.ERROR));
        validTransitions.put(JobStatus.DONE, EnumSet.noneOf(JobStatus.class));
        validTransitions.put(JobStatus.ERROR, EnumSet.noneOf(JobStatus.class));
    }

    /**
     * Check if a state transition is valid. Staying in place is not a transition.
     */
    public boolean isValidTransition(@NonNull JobStatus currentState, @NonNull JobStatus newState) {
        Set<JobStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Move a job to a new status, stamping the transition.
     *
     * @throws IllegalStateException if the transition is invalid or the caller does not own the job
     */
    public void transition(@NonNull Job job, @NonNull JobStatus newState) {
        JobStatus currentState = job.getStatus();
        if (!isValidTransition(currentState, newState)) {
            throw new IllegalStateException(String.format(
                    "Invalid state transition for job %s: %s → %s",
                    job.getId(), currentState, newState));
        }

        job.recordTransition(newState, clock.instant());
        log.debug("Job {} state transition: {} → {}", job.getId(), currentState, newState);
    }

    public boolean isTerminalState(@NonNull JobStatus state) {
        Set<JobStatus> allowedTransitions = validTransitions.get(state);
        return allowedTransitions == null || allowedTransitions.isEmpty();
    }

    public Set<JobStatus> getValidNextStates(@NonNull JobStatus currentState) {
        Set<JobStatus> states = validTransitions.get(currentState);
        return states != null && !states.isEmpty() ? EnumSet.copyOf(states) : EnumSet.noneOf(JobStatus.class);
    }
}
