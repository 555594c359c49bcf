package com.concord.core.planner;

import com.concord.core.error.PlanningException;
import com.concord.core.error.ValidationException;
import com.concord.core.knowledge.KnowledgeStore;
import com.concord.core.metrics.CoordinationMetrics;
import com.concord.core.model.ComplexityClass;
import com.concord.core.model.Constraint;
import com.concord.core.model.ContingencyPlan;
import com.concord.core.model.DependencyEdge;
import com.concord.core.model.DependencyKind;
import com.concord.core.model.Objective;
import com.concord.core.model.RiskAssessment;
import com.concord.core.model.SuccessCriterion;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskUnit;
import com.concord.core.registry.AgentRegistry;
import com.concord.core.registry.RegistrySnapshot;
import com.concord.core.strategy.PhaseSpec;
import com.concord.core.strategy.StrategyCatalog;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns an {@link Objective} into a {@link TaskPlan}.
 * <p>
 * The objective is classified, expanded through the phase template of its class
 * (sub-objectives recursively, hanging off the parent's prepare phase and joining before
 * its closing phases), checked against its constraints, assessed for risk and given
 * contingencies for its riskiest units. When the classified template violates a
 * mandatory constraint each simpler template is tried before planning fails.
 */
@Service
public class DecisionPlanner {

    private static final Logger log = LoggerFactory.getLogger(DecisionPlanner.class);

    private static final Set<String> CLOSING_PHASES = Set.of("integrate", "validate", "report");

    private final StrategyCatalog catalog;
    private final PlannerProperties properties;
    private final AgentRegistry registry;
    private final CoordinationMetrics metrics;
    private final ComplexityClassifier classifier;
    private final RiskAssessor riskAssessor;
    private final ContingencyPlanner contingencyPlanner;
    private final Clock clock;
    // objectives of recent plans, for replanning and execution priority
    private final Cache<String, Objective> objectivesByPlan;

    @Autowired
    public DecisionPlanner(StrategyCatalog catalog, PlannerProperties properties,
                           @Autowired(required = false) AgentRegistry registry,
                           @Autowired(required = false) KnowledgeStore knowledgeStore,
                           @Autowired(required = false) CoordinationMetrics metrics) {
        this(catalog, properties, registry, knowledgeStore, metrics, Clock.systemUTC());
    }

    public DecisionPlanner(StrategyCatalog catalog, PlannerProperties properties, AgentRegistry registry,
                           KnowledgeStore knowledgeStore, CoordinationMetrics metrics, Clock clock) {
        this.catalog = catalog;
        this.properties = properties;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.classifier = new ComplexityClassifier(catalog, properties, clock);
        this.riskAssessor = new RiskAssessor(properties, knowledgeStore);
        this.contingencyPlanner = new ContingencyPlanner(catalog);
        this.objectivesByPlan = Caffeine.newBuilder()
                .maximumSize(properties.getRetainedObjectives())
                .build();
    }

    /** Plans against the current registry snapshot. */
    public TaskPlan plan(Objective objective) {
        RegistrySnapshot snapshot = registry != null ? registry.snapshot() : RegistrySnapshot.of(List.of());
        return plan(objective, snapshot);
    }

    /**
     * @throws ValidationException if the objective is malformed
     * @throws PlanningException   if no template satisfies the mandatory constraints
     */
    public TaskPlan plan(Objective objective, RegistrySnapshot snapshot) {
        long start = System.currentTimeMillis();
        validate(objective);
        String planId = generatePlanId();
        ComplexityClassifier.Assessment assessment = classifier.assess(objective);

        var diagnostics = new ArrayList<String>();
        for (ComplexityClass c = assessment.complexity(); c != null; c = c.simpler()) {
            Decomposition d = new Decomposition(planId);
            expand(objective, c, true, d);
            DependencyGraph graph = new DependencyGraph(d.unitIds(), d.edges);

            var mandatory = new ArrayList<String>();
            var optional = new ArrayList<String>();
            checkConstraints(objective, d, graph, snapshot, mandatory, optional);
            if (!mandatory.isEmpty()) {
                log.info("Template {} for objective {} rejected: {}", c, objective.id(), mandatory);
                diagnostics.add(c + ": " + String.join("; ", mandatory));
                continue;
            }

            TaskPlan plan = assemble(planId, objective, c, d, graph, assessment.normalized(),
                    optional.size(), snapshot);
            objectivesByPlan.put(planId, objective);
            long elapsed = System.currentTimeMillis() - start;
            log.info("Planned {} for objective {}: {} {} task(s), {} edge(s), risk {} ({}), {} contingenc(ies)",
                    planId, objective.id(), c, plan.tasks().size(), plan.edges().size(),
                    String.format("%.2f", plan.risk().overallRisk()), plan.risk().level(),
                    plan.contingencies().size());
            if (metrics != null) {
                metrics.recordPlanningDuration(c.name(), elapsed);
                metrics.recordPlanSize(plan.tasks().size());
            }
            return plan;
        }
        throw new PlanningException(PlanningException.Reason.INFEASIBLE,
                "No decomposition of objective " + objective.id() + " satisfies its mandatory constraints",
                diagnostics);
    }

    /**
     * Plans the objective behind {@code plan} again under a new plan id.
     *
     * @throws ValidationException if the plan was not produced by this planner
     */
    public TaskPlan replan(TaskPlan plan, String reason) {
        Objective objective = objectivesByPlan.getIfPresent(plan.id());
        if (objective == null) {
            throw new ValidationException("Unknown plan " + plan.id() + "; cannot replan");
        }
        log.info("Replanning objective {} (was {}): {}", objective.id(), plan.id(), reason);
        return plan(objective);
    }

    public Optional<Objective> objectiveOf(String planId) {
        return Optional.ofNullable(objectivesByPlan.getIfPresent(planId));
    }

    /** {@code PLAN-<year>-<random uuid>}: unique across restarts and coordinators sharing a store. */
    public String generatePlanId() {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return "PLAN-" + year + "-" + UUID.randomUUID();
    }

    // ── Decomposition ────────────────────────────────────────────────────

    private static final class Decomposition {
        final String planId;
        final List<TaskUnit> units = new ArrayList<>();
        final List<DependencyEdge> edges = new ArrayList<>();
        final Map<String, Set<String>> subtreeUnits = new HashMap<>();
        int counter;

        Decomposition(String planId) {
            this.planId = planId;
        }

        String nextId() {
            return String.format("%s-T%03d", planId, ++counter);
        }

        List<String> unitIds() {
            return units.stream().map(TaskUnit::id).toList();
        }
    }

    private record Subtree(TaskUnit first, TaskUnit last, Set<String> unitIds) {}

    private Subtree expand(Objective objective, ComplexityClass cap, boolean root, Decomposition d) {
        ComplexityClass cls = cap;
        if (!root) {
            ComplexityClass own = classifier.assess(objective).complexity();
            cls = own.ordinal() < cap.ordinal() ? own : cap;
        }
        String primary = catalog.primaryCapability(objective.description());
        var own = new ArrayList<TaskUnit>();
        var subtree = new LinkedHashSet<String>();
        TaskUnit previous = null;
        for (PhaseSpec phase : catalog.phases(cls)) {
            var unit = new TaskUnit(d.nextId(), d.planId, phase.name(),
                    phase.name() + ": " + objective.description(),
                    Set.of(catalog.capabilityFor(phase, primary)),
                    phase.duration(), phase.preconditions(), expectedOutcome(phase, objective));
            d.units.add(unit);
            own.add(unit);
            subtree.add(unit.id());
            if (previous != null) {
                d.edges.add(new DependencyEdge(previous.id(), unit.id(),
                        phase.conditional() ? DependencyKind.CONDITIONAL : DependencyKind.SEQUENTIAL));
            }
            previous = unit;
        }

        TaskUnit anchor = own.stream().filter(u -> "prepare".equals(u.phase())).findFirst().orElse(null);
        TaskUnit join = own.stream().filter(u -> CLOSING_PHASES.contains(u.phase())).findFirst().orElse(null);
        for (Objective child : objective.subObjectives()) {
            Subtree sub = expand(child, cls, false, d);
            if (anchor != null) {
                d.edges.add(new DependencyEdge(anchor.id(), sub.first().id(), DependencyKind.PARALLEL_SAFE));
            }
            if (join != null) {
                d.edges.add(new DependencyEdge(sub.last().id(), join.id(), DependencyKind.SEQUENTIAL));
            }
            subtree.addAll(sub.unitIds());
        }
        d.subtreeUnits.put(objective.id(), subtree);
        return new Subtree(own.get(0), own.get(own.size() - 1), subtree);
    }

    private static String expectedOutcome(PhaseSpec phase, Objective objective) {
        if (("validate".equals(phase.name()) || "execute".equals(phase.name()))
                && !objective.successCriteria().isEmpty()) {
            return objective.successCriteria().stream()
                    .map(SuccessCriterion::description)
                    .collect(Collectors.joining("; "));
        }
        return phase.name() + " completed for " + objective.id();
    }

    private TaskPlan assemble(String planId, Objective objective, ComplexityClass complexity, Decomposition d,
                              DependencyGraph graph, double complexityScore, int optionalViolations,
                              RegistrySnapshot snapshot) {
        var byId = new LinkedHashMap<String, TaskUnit>();
        d.units.forEach(u -> byId.put(u.id(), u));
        List<TaskUnit> ordered = graph.topologicalOrder().stream().map(byId::get).toList();

        var durations = new HashMap<String, Duration>();
        ordered.forEach(u -> durations.put(u.id(), u.estimatedDuration()));
        Duration estimate = graph.criticalPath(durations);

        RiskAssessment risk = riskAssessor.assess(ordered, graph, complexityScore, optionalViolations, snapshot);
        List<ContingencyPlan> contingencies = contingencyPlanner.prepare(ordered, risk, properties.getRiskThreshold());
        return new TaskPlan(planId, objective.id(), complexity, ordered, d.edges, estimate, risk, contingencies,
                0, Instant.now(clock));
    }

    // ── Constraints ──────────────────────────────────────────────────────

    private void checkConstraints(Objective objective, Decomposition d, DependencyGraph graph,
                                  RegistrySnapshot snapshot, List<String> mandatory, List<String> optional) {
        Set<String> scope = d.subtreeUnits.getOrDefault(objective.id(), Set.of());
        for (Constraint constraint : objective.constraints()) {
            String violation = violation(constraint, scope, d, graph, snapshot);
            if (violation != null) {
                (constraint.mandatory() ? mandatory : optional).add(constraint.id() + ": " + violation);
            }
        }
        for (Objective child : objective.subObjectives()) {
            checkConstraints(child, d, graph, snapshot, mandatory, optional);
        }
    }

    private static String violation(Constraint constraint, Set<String> scope, Decomposition d,
                                    DependencyGraph graph, RegistrySnapshot snapshot) {
        String value = constraint.value().trim();
        switch (constraint.kind()) {
            case REQUIRED_CAPABILITY:
                return snapshot.declares(value) ? null : "no registered agent declares '" + value + "'";
            case EXCLUDED_CAPABILITY:
                var offending = d.units.stream()
                        .filter(u -> scope.contains(u.id()) && u.requiredCapabilities().contains(value))
                        .map(TaskUnit::id)
                        .toList();
                return offending.isEmpty() ? null : "excluded capability '" + value + "' required by " + offending;
            case MAX_TASKS:
                int max = Integer.parseInt(value);
                return scope.size() <= max ? null : scope.size() + " tasks exceed the limit of " + max;
            case MAX_DURATION:
                Duration limit = Duration.parse(value);
                var durations = new HashMap<String, Duration>();
                d.units.stream().filter(u -> scope.contains(u.id()))
                        .forEach(u -> durations.put(u.id(), u.estimatedDuration()));
                Duration estimate = graph.subgraph(scope).criticalPath(durations);
                return estimate.compareTo(limit) <= 0 ? null : "estimate " + estimate + " exceeds " + limit;
            default:
                return null;
        }
    }

    // ── Validation ───────────────────────────────────────────────────────

    private void validate(Objective objective) {
        if (objective == null) {
            throw new ValidationException("Objective must not be null");
        }
        var violations = new ArrayList<String>();
        validate(objective, new HashSet<>(), violations);
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid objective: " + String.join("; ", violations), violations);
        }
    }

    private void validate(Objective objective, Set<String> objectiveIds, List<String> violations) {
        String where = objective.id() != null ? "objective " + objective.id() : "objective";
        if (objective.id() == null || objective.id().isBlank()) {
            violations.add("objective id must not be blank");
        } else if (!objectiveIds.add(objective.id())) {
            violations.add("duplicate objective id " + objective.id());
        }
        if (objective.description() == null || objective.description().isBlank()) {
            violations.add(where + ": description must not be blank");
        }
        var criterionIds = new HashSet<String>();
        for (SuccessCriterion criterion : objective.successCriteria()) {
            if (criterion.id() == null || !criterionIds.add(criterion.id())) {
                violations.add(where + ": duplicate or missing success criterion id " + criterion.id());
            }
        }
        var constraintIds = new HashSet<String>();
        for (Constraint constraint : objective.constraints()) {
            if (constraint.id() == null || !constraintIds.add(constraint.id())) {
                violations.add(where + ": duplicate or missing constraint id " + constraint.id());
            }
            String problem = malformed(constraint);
            if (problem != null) {
                violations.add(where + ": constraint " + constraint.id() + " " + problem);
            }
        }
        for (Objective child : objective.subObjectives()) {
            validate(child, objectiveIds, violations);
        }
    }

    private static String malformed(Constraint constraint) {
        if (constraint.kind() == null) {
            return "has no kind";
        }
        if (constraint.value() == null || constraint.value().isBlank()) {
            return "has no value";
        }
        String value = constraint.value().trim();
        switch (constraint.kind()) {
            case MAX_TASKS:
                try {
                    return Integer.parseInt(value) >= 1 ? null : "must allow at least one task";
                } catch (NumberFormatException e) {
                    return "is not a task count: '" + value + "'";
                }
            case MAX_DURATION:
                try {
                    Duration limit = Duration.parse(value);
                    return limit.isNegative() || limit.isZero() ? "must be a positive duration" : null;
                } catch (DateTimeParseException e) {
                    return "is not an ISO-8601 duration: '" + value + "'";
                }
            default:
                return null;
        }
    }
}
