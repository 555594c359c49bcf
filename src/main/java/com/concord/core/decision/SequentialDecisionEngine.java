package com.concord.core.decision;

import com.concord.core.concurrent.CancellationToken;
import com.concord.core.engine.CoordinationProperties;
import com.concord.core.error.CoordinationException;
import com.concord.core.knowledge.KnowledgeStore;
import com.concord.core.logging.MdcContext;
import com.concord.core.metrics.CoordinationMetrics;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.CandidateAction;
import com.concord.core.model.Decision;
import com.concord.core.model.DecisionKind;
import com.concord.core.model.DecisionType;
import com.concord.core.model.HistoricalPattern;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.TaskAssignment;
import com.concord.core.model.TaskOutcome;
import com.concord.core.model.TaskStatus;
import com.concord.core.model.TaskUnit;
import com.concord.core.planner.PlannerProperties;
import com.concord.core.strategy.PatternSpec;
import com.concord.core.strategy.ScoringWeights;
import com.concord.core.strategy.StrategyCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Drives one assigned {@link TaskUnit} to a terminal state.
 * <p>
 * The unit runs as a sequence of steps: one per precondition, then the main step. Each
 * step enumerates the workflow patterns of the capabilities the unit requires and the
 * assigned agent declares, scores them and dispatches the best one. When a step fails the
 * engine walks its open decision points backward to the most recent one with untried
 * alternatives, re-scores those and resumes from that step. Every choice and every
 * backtrack is appended to the task's {@link DecisionLog}.
 */
@Service
public class SequentialDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(SequentialDecisionEngine.class);

    static final String MAIN_STEP = "main";
    private static final double FAILED_PATTERN_PENALTY = 0.5;
    private static final double OVERDUE_FIT = 0.05;

    private final StrategyCatalog catalog;
    private final PlannerProperties plannerProperties;
    private final CoordinationProperties properties;
    private final ActionDispatcher dispatcher;
    private final KnowledgeStore knowledgeStore;
    private final CoordinationMetrics metrics;
    private final Clock clock;

    @Autowired
    public SequentialDecisionEngine(StrategyCatalog catalog, PlannerProperties plannerProperties,
                                    CoordinationProperties properties, ActionDispatcher dispatcher,
                                    @Autowired(required = false) KnowledgeStore knowledgeStore,
                                    @Autowired(required = false) CoordinationMetrics metrics) {
        this(catalog, plannerProperties, properties, dispatcher, knowledgeStore, metrics, Clock.systemUTC());
    }

    public SequentialDecisionEngine(StrategyCatalog catalog, PlannerProperties plannerProperties,
                                    CoordinationProperties properties, ActionDispatcher dispatcher,
                                    KnowledgeStore knowledgeStore, CoordinationMetrics metrics, Clock clock) {
        this.catalog = catalog;
        this.plannerProperties = plannerProperties;
        this.properties = properties;
        this.dispatcher = dispatcher;
        this.knowledgeStore = knowledgeStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Executes {@code unit} on the assigned agent.
     *
     * @param objectiveDeadline deadline of the owning objective, used for deadline fit (nullable)
     * @return the terminal outcome with the full decision log; never throws for step
     *         failures, which end in a FAILED outcome
     */
    public TaskOutcome execute(TaskUnit unit, TaskAssignment assignment, AgentInstance agent,
                               Instant objectiveDeadline, CancellationToken token) {
        try (var mdc = MdcContext.task(unit.planId(), unit.id(), agent.id())) {
            return run(unit, assignment, agent, objectiveDeadline, token);
        }
    }

    private TaskOutcome run(TaskUnit unit, TaskAssignment assignment, AgentInstance agent,
                            Instant objectiveDeadline, CancellationToken token) {
        Instant started = clock.instant();
        Duration timeout = unit.timeoutOr(properties.getExecution().getTaskTimeout());
        Instant timeoutAt = started.plus(timeout);
        Instant deadline = objectiveDeadline != null && objectiveDeadline.isBefore(timeoutAt)
                ? objectiveDeadline : timeoutAt;

        List<String> steps = new ArrayList<>(unit.preconditions());
        steps.add(MAIN_STEP);

        var runState = new RunState(unit, agent, new DecisionLog(unit.id()), started);
        Deque<DecisionPoint> open = new ArrayDeque<>();
        List<CandidateAction> resumeWith = null;
        int step = 0;

        while (step < steps.size()) {
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                return runState.cancelled("Cancelled before step " + steps.get(step));
            }
            Instant now = clock.instant();
            if (!now.isBefore(timeoutAt)) {
                return runState.failed("Timed out after " + timeout);
            }

            List<CandidateAction> candidates = resumeWith != null
                    ? rescore(resumeWith, runState, deadline, now)
                    : enumerate(step, runState, deadline, now);
            resumeWith = null;

            String failure;
            if (candidates.isEmpty()) {
                failure = "No candidate action for step " + steps.get(step) + " within agent "
                        + agent.id() + "'s capabilities";
            } else {
                CandidateAction selected = candidates.get(0);
                List<CandidateAction> rest = new ArrayList<>(candidates.subList(1, candidates.size()));
                Decision choice = runState.append(new Decision(newId(), unit.id(), now,
                        step == steps.size() - 1 ? DecisionType.TACTICAL : DecisionType.OPERATIONAL,
                        DecisionKind.CHOICE, step, selected, selected.successProbability(), rest,
                        rationale(steps.get(step), selected, rest), runState.lastDecisionId()));
                open.push(new DecisionPoint(step, rest));

                PatternOutcome outcome;
                try {
                    outcome = dispatch(assignment, unit, selected, steps.get(step), runState, timeoutAt);
                } catch (CancellationException e) {
                    return runState.cancelled("Cancelled during step " + steps.get(step));
                }
                saveOutcome(choice, outcome);
                if (outcome.success()) {
                    runState.output = outcome.output();
                    step++;
                    continue;
                }
                runState.failedPatterns.add(selected.patternId());
                failure = "Pattern " + selected.patternId() + " failed at step " + steps.get(step)
                        + ": " + outcome.error();
            }

            log.info("Task {} step {} failed: {}", unit.id(), steps.get(step), failure);
            runState.lastError = failure;

            DecisionPoint resumePoint = null;
            while (!open.isEmpty()) {
                DecisionPoint point = open.pop();
                if (!point.remaining().isEmpty()) {
                    resumePoint = point;
                    break;
                }
            }
            if (resumePoint == null) {
                return runState.failed("Alternatives exhausted. " + failure);
            }
            if (runState.backtracks >= properties.getExecution().getMaxBacktracks()) {
                return runState.failed("Backtrack limit " + properties.getExecution().getMaxBacktracks()
                        + " reached. " + failure);
            }
            runState.backtracks++;
            if (metrics != null) {
                metrics.recordBacktrack();
            }
            runState.append(new Decision(newId(), unit.id(), clock.instant(), DecisionType.REACTIVE,
                    DecisionKind.BACKTRACK, resumePoint.step(), null, 0.0, resumePoint.remaining(),
                    "Backtracking from step " + steps.get(step) + " to step " + steps.get(resumePoint.step())
                            + " with " + resumePoint.remaining().size() + " untried alternative(s)",
                    runState.lastDecisionId()));
            step = resumePoint.step();
            resumeWith = resumePoint.remaining();
        }

        return runState.completed(steps.size());
    }

    private PatternOutcome dispatch(TaskAssignment assignment, TaskUnit unit, CandidateAction action,
                                    String stepName, RunState runState, Instant timeoutAt) {
        Duration remaining = Duration.between(clock.instant(), timeoutAt);
        if (remaining.isNegative() || remaining.isZero()) {
            return PatternOutcome.failed("No time left for step " + stepName, Duration.ZERO);
        }
        Map<String, Object> context = new HashMap<>();
        context.put("step", stepName);
        context.put("description", unit.description());
        context.put("phase", unit.phase());
        context.put("expectedOutcome", unit.expectedOutcome());
        context.put("previousOutput", runState.output);
        context.values().removeIf(Objects::isNull);
        try {
            return dispatcher.dispatch(assignment, unit, action, context, remaining);
        } catch (CoordinationException e) {
            return PatternOutcome.failed(e.getCategory() + ": " + e.getMessage(), Duration.ZERO);
        }
    }

    /** Candidates for a fresh step, best first. */
    List<CandidateAction> enumerate(int step, RunState runState, Instant deadline, Instant now) {
        Set<String> capabilities = new TreeSet<>();
        for (String tag : runState.unit.requiredCapabilities()) {
            if (runState.agent.hasCapability(tag)) {
                capabilities.add(tag);
            }
        }
        if (runState.unit.requiredCapabilities().isEmpty()) {
            capabilities.addAll(runState.agent.capabilities().keySet());
        }

        var candidates = new ArrayList<CandidateAction>();
        for (String capability : capabilities) {
            Map<String, HistoricalPattern> history = runState.history(capability);
            for (PatternSpec spec : catalog.patternsFor(capability)) {
                double base = blend(spec.baseSuccess(), history.get(spec.patternId()));
                double confidence = runState.agent.confidence(capability);
                double p = base * (0.5 + 0.5 * confidence);
                var action = new CandidateAction(step + ":" + spec.patternId(), spec.patternId(), spec.kind(),
                        capability, p, spec.resourceCost(), 0.0, 0.0);
                candidates.add(score(action, p, spec.typicalDuration(), runState, deadline, now));
            }
        }
        candidates.sort(BEST_FIRST);
        return candidates;
    }

    /** Re-scores the untried alternatives of a decision point against the current state. */
    private List<CandidateAction> rescore(List<CandidateAction> alternatives, RunState runState,
                                          Instant deadline, Instant now) {
        var rescored = new ArrayList<CandidateAction>(alternatives.size());
        for (CandidateAction a : alternatives) {
            Duration typical = catalog.patternsFor(a.capability()).stream()
                    .filter(s -> s.patternId().equals(a.patternId()))
                    .map(PatternSpec::typicalDuration)
                    .findFirst()
                    .orElse(Duration.ZERO);
            rescored.add(score(a, a.successProbability(), typical, runState, deadline, now));
        }
        rescored.sort(BEST_FIRST);
        return rescored;
    }

    private CandidateAction score(CandidateAction action, double successProbability, Duration typical,
                                  RunState runState, Instant deadline, Instant now) {
        double p = runState.failedPatterns.contains(action.patternId())
                ? successProbability * FAILED_PATTERN_PENALTY
                : successProbability;
        double fit = deadlineFit(typical, deadline, now);
        ScoringWeights weights = catalog.weights();
        return action.withScore(weights.score(p, action.resourceCost(), fit), p, fit);
    }

    private double blend(double baseSuccess, HistoricalPattern history) {
        if (history == null || history.samples() < plannerProperties.getMinHistorySamples()) {
            return baseSuccess;
        }
        double b = plannerProperties.getHistoryBlend();
        return (1 - b) * baseSuccess + b * history.successRate();
    }

    static double deadlineFit(Duration typical, Instant deadline, Instant now) {
        if (deadline == null) {
            return 1.0;
        }
        Duration remaining = Duration.between(now, deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return OVERDUE_FIT;
        }
        if (typical.isZero()) {
            return 1.0;
        }
        return Math.min(1.0, (double) remaining.toMillis() / typical.toMillis());
    }

    private void saveOutcome(Decision decision, PatternOutcome outcome) {
        if (knowledgeStore == null) {
            return;
        }
        try {
            knowledgeStore.saveDecisionOutcome(decision, outcome);
        } catch (RuntimeException e) {
            log.warn("Could not record outcome of decision {}: {}", decision.id(), e.getMessage());
        }
    }

    private static String rationale(String stepName, CandidateAction selected, List<CandidateAction> rest) {
        var sb = new StringBuilder();
        sb.append("Step ").append(stepName).append(": ").append(selected.patternId())
                .append(String.format(" scored %.3f (p=%.2f, cost=%.2f, fit=%.2f)", selected.score(),
                        selected.successProbability(), selected.resourceCost(), selected.deadlineFit()));
        if (!rest.isEmpty()) {
            sb.append("; next best ").append(rest.get(0).patternId())
                    .append(String.format(" at %.3f", rest.get(0).score()));
        }
        return sb.toString();
    }

    private static String newId() {
        return "D-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static final Comparator<CandidateAction> BEST_FIRST =
            Comparator.comparingDouble(CandidateAction::score).reversed()
                    .thenComparing(CandidateAction::patternId);

    private record DecisionPoint(int step, List<CandidateAction> remaining) {}

    /** Mutable state of one run; confined to the executing thread. */
    final class RunState {

        final TaskUnit unit;
        final AgentInstance agent;
        final DecisionLog decisions;
        final Instant started;
        final Set<String> failedPatterns = new HashSet<>();
        private final Map<String, Map<String, HistoricalPattern>> historyByCapability = new HashMap<>();
        Map<String, Object> output = Map.of();
        String lastError;
        int backtracks;

        RunState(TaskUnit unit, AgentInstance agent, DecisionLog decisions, Instant started) {
            this.unit = unit;
            this.agent = agent;
            this.decisions = decisions;
            this.started = started;
        }

        Decision append(Decision decision) {
            return decisions.append(decision);
        }

        String lastDecisionId() {
            return decisions.last().map(Decision::id).orElse(null);
        }

        Map<String, HistoricalPattern> history(String capability) {
            return historyByCapability.computeIfAbsent(capability, this::loadHistory);
        }

        private Map<String, HistoricalPattern> loadHistory(String capability) {
            if (knowledgeStore == null) {
                return Map.of();
            }
            try {
                var byPattern = new HashMap<String, HistoricalPattern>();
                for (HistoricalPattern h : knowledgeStore.queryHistoricalPatterns(capability)) {
                    byPattern.put(h.patternId(), h);
                }
                return byPattern;
            } catch (RuntimeException e) {
                log.warn("Pattern history for {} unavailable: {}", capability, e.getMessage());
                return Map.of();
            }
        }

        TaskOutcome completed(int stepCount) {
            terminal(DecisionKind.COMPLETED, "All " + stepCount + " step(s) succeeded", 1.0);
            return outcome(TaskStatus.COMPLETED, null);
        }

        TaskOutcome failed(String reason) {
            terminal(DecisionKind.FAILED, reason, 0.0);
            return outcome(TaskStatus.FAILED, reason);
        }

        TaskOutcome cancelled(String reason) {
            terminal(DecisionKind.CANCELLED, reason, 0.0);
            return outcome(TaskStatus.CANCELLED, reason);
        }

        private void terminal(DecisionKind kind, String rationale, double confidence) {
            append(new Decision(newId(), unit.id(), clock.instant(), DecisionType.OPERATIONAL, kind, -1,
                    null, confidence, List.of(), rationale, lastDecisionId()));
        }

        private TaskOutcome outcome(TaskStatus status, String error) {
            Duration elapsed = Duration.between(started, clock.instant());
            if (metrics != null) {
                metrics.recordTaskExecution(status.name(), elapsed.toMillis());
            }
            log.info("Task {} on {} finished {} after {} backtrack(s) in {}ms", unit.id(), agent.id(), status,
                    backtracks, elapsed.toMillis());
            return new TaskOutcome(unit.id(), agent.id(), status, decisions.entries(), output, error, elapsed);
        }
    }
}
