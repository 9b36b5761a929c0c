/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.foldstream.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.foldstream.eventstore.api.*;
import org.foldstream.projection.ProjectionDefinition;
import org.foldstream.projection.ProjectionEngine;
import org.foldstream.projection.ProjectionRegistry;
import org.foldstream.projection.ProjectionSnapshot;
import org.foldstream.retry.RetryStrategy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CommandStepTracker} that records the steps of each command instance as events in an event stream of its own,
 * addressed by the {@link CommandIdentity}. The current steps are found by folding that stream, and each new fact is appended
 * with the sequence number the fold reflected as expected sequence number. If someone else appended in between, the stream
 * is folded again and the transition is validated again, at most {@code maxAttempts} times.
 * <p>
 * Use an {@link EventStreamStore} dedicated to commands so that command streams never share identity with entity streams.
 * </p>
 */
public class EventSourcedCommandStepTracker implements CommandStepTracker {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedCommandStepTracker.class);

    static final String STEP_INITIATED = "StepInitiated";
    static final String STEP_COMPLETED = "StepCompleted";
    static final String STEP_FAILED = "StepFailed";
    private static final int DEFAULT_MAX_ATTEMPTS = 10;

    private final EventStreamStore eventStore;
    private final ProjectionEngine projectionEngine;
    private final ObjectMapper objectMapper;
    private final RetryStrategy.Retry retryOnConflict;

    public EventSourcedCommandStepTracker(EventStreamStore eventStore) {
        this(eventStore, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @param eventStore  The event store that keeps the command streams
     * @param maxAttempts How many times a transition is attempted when appends from other callers keep getting in between
     */
    public EventSourcedCommandStepTracker(EventStreamStore eventStore, int maxAttempts) {
        requireNonNull(eventStore, EventStreamStore.class.getSimpleName() + " cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be greater than zero");
        }
        this.eventStore = eventStore;
        this.projectionEngine = new ProjectionEngine(eventStore, new ProjectionRegistry());
        this.objectMapper = new ObjectMapper();
        this.retryOnConflict = RetryStrategy.retry().maxAttempts(maxAttempts).retryIf(ConcurrencyConflictException.class::isInstance);
    }

    @Override
    public CommandStepRecord initiateStep(CommandIdentity command, String stepName, EventStreamIdentity target) {
        requireNonNull(target, "Target cannot be null");
        return transition(command, stepName, STEP_INITIATED, (current) -> {
            if (current != null) {
                throw new StepAlreadyInitiatedException(command, stepName, current.status());
            }
            return new CommandStepRecord(command, stepName, StepStatus.INITIATED, target, null);
        });
    }

    @Override
    public CommandStepRecord stepCompleted(CommandIdentity command, String stepName, @Nullable String resultText) {
        return terminate(command, stepName, STEP_COMPLETED, resultText);
    }

    @Override
    public CommandStepRecord stepFailed(CommandIdentity command, String stepName, @Nullable String resultText) {
        return terminate(command, stepName, STEP_FAILED, resultText);
    }

    @Override
    public Optional<CommandStepRecord> findStep(CommandIdentity command, String stepName) {
        requireNonNull(stepName, "Step name cannot be null");
        return Optional.ofNullable(currentSteps(command).state().get(stepName));
    }

    @Override
    public List<CommandStepRecord> steps(CommandIdentity command) {
        return new ArrayList<>(currentSteps(command).state().values());
    }

    private CommandStepRecord terminate(CommandIdentity command, String stepName, String eventType, @Nullable String resultText) {
        StepStatus status = STEP_COMPLETED.equals(eventType) ? StepStatus.COMPLETED : StepStatus.FAILED;
        return transition(command, stepName, eventType, (current) -> {
            if (current == null || current.status().isTerminal()) {
                throw new StepNotInitiatedException(command, stepName, current == null ? null : current.status());
            }
            return new CommandStepRecord(command, stepName, status, current.target(), resultText);
        });
    }

    private CommandStepRecord transition(CommandIdentity command, String stepName, String eventType, StepTransition stepTransition) {
        requireNonNull(command, CommandIdentity.class.getSimpleName() + " cannot be null");
        requireNonNull(stepName, "Step name cannot be null");
        EventStreamIdentity identity = command.toEventStreamIdentity();

        RetryStrategy retryStrategy = retryOnConflict.onRetryableError((info, e) ->
                log.warn("Command {} changed while recording {} for step {} (attempt {} of {}), retrying.", command, eventType, stepName, info.attemptNumber(), info.maxAttempts()));
        return retryStrategy.execute(() -> {
            ProjectionSnapshot<Map<String, CommandStepRecord>> steps = currentSteps(command);
            CommandStepRecord next = stepTransition.next(steps.state().get(stepName));
            StepEvent stepEvent = next.status() == StepStatus.INITIATED ?
                    new StepEvent(stepName, next.targetDomain(), next.targetEntityType(), next.targetInstanceKey(), null) :
                    new StepEvent(stepName, null, null, null, next.resultText());
            EventRecord event = EventRecord.of(eventType, objectMapper.valueToTree(stepEvent));
            eventStore.append(identity, event, AppendConstraint.expectedSequenceNumber(steps.currentSequenceNumber()));
            log.debug("Recorded {} for step {} of command {}", eventType, stepName, command);
            return next;
        });
    }

    private ProjectionSnapshot<Map<String, CommandStepRecord>> currentSteps(CommandIdentity command) {
        requireNonNull(command, CommandIdentity.class.getSimpleName() + " cannot be null");
        ProjectionSnapshot<Map<String, CommandStepRecord>> snapshot = projectionEngine.process(command.toEventStreamIdentity(), stepsOf(command), null);
        if (snapshot == null) {
            return new ProjectionSnapshot<>(command.commandName(), Collections.emptyMap(), 0, null);
        }
        return snapshot;
    }

    private ProjectionDefinition<Map<String, CommandStepRecord>> stepsOf(CommandIdentity command) {
        return ProjectionDefinition.<Map<String, CommandStepRecord>>builder(command.commandName(), Collections.emptyMap())
                .on(STEP_INITIATED, (steps, envelope) -> {
                    StepEvent e = readStepEvent(envelope);
                    EventStreamIdentity target = EventStreamIdentity.of(requireNonNull(e.targetDomain()), requireNonNull(e.targetEntityType()), requireNonNull(e.targetInstanceKey()));
                    return with(steps, new CommandStepRecord(command, e.stepName(), StepStatus.INITIATED, target, null));
                })
                .on(STEP_COMPLETED, (steps, envelope) -> withStatus(steps, readStepEvent(envelope), StepStatus.COMPLETED))
                .on(STEP_FAILED, (steps, envelope) -> withStatus(steps, readStepEvent(envelope), StepStatus.FAILED))
                .build();
    }

    private StepEvent readStepEvent(EventEnvelope envelope) {
        try {
            return objectMapper.treeToValue(envelope.payload(), StepEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Couldn't read " + envelope.eventType() + " event with sequence number " + envelope.sequenceNumber(), e);
        }
    }

    private static Map<String, CommandStepRecord> withStatus(Map<String, CommandStepRecord> steps, StepEvent e, StepStatus status) {
        CommandStepRecord current = steps.get(e.stepName());
        if (current == null) {
            return steps;
        }
        return with(steps, new CommandStepRecord(current.command(), current.stepName(), status, current.target(), e.resultText()));
    }

    private static Map<String, CommandStepRecord> with(Map<String, CommandStepRecord> steps, CommandStepRecord step) {
        Map<String, CommandStepRecord> copy = new LinkedHashMap<>(steps);
        copy.put(step.stepName(), step);
        return Collections.unmodifiableMap(copy);
    }

    @FunctionalInterface
    private interface StepTransition {
        CommandStepRecord next(@Nullable CommandStepRecord current);
    }

    record StepEvent(String stepName, @Nullable String targetDomain, @Nullable String targetEntityType, @Nullable String targetInstanceKey,
                     @Nullable String resultText) {
    }
}
