package com.concord.core.strategy;

import com.concord.core.model.ActionKind;
import com.concord.core.model.ComplexityClass;
import com.concord.core.planner.PlannerProperties;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Everything the planner and the decision engine look up by name: the phase template
 * per complexity class, the description keyword to capability table, the keywords that
 * raise complexity, the capability to workflow-pattern dispatch table and the scoring
 * weights. Immutable; built once per application context.
 */
public final class StrategyCatalog {

    public static final String GENERAL = "general";

    private static final PhaseSpec ANALYZE = new PhaseSpec("analyze", "analyze", Duration.ofMinutes(10), List.of(), false);
    private static final PhaseSpec DESIGN = new PhaseSpec("design", "analyze", Duration.ofMinutes(15), List.of(), false);
    private static final PhaseSpec PREPARE = new PhaseSpec("prepare", null, Duration.ofMinutes(5), List.of(), false);
    private static final PhaseSpec EXECUTE = new PhaseSpec("execute", null, Duration.ofMinutes(20), List.of(), false);
    private static final PhaseSpec INTEGRATE = new PhaseSpec("integrate", null, Duration.ofMinutes(10),
            List.of("components available"), false);
    private static final PhaseSpec VALIDATE = new PhaseSpec("validate", "validate", Duration.ofMinutes(5),
            List.of("outputs present"), false);
    private static final PhaseSpec REPORT = new PhaseSpec("report", "report", Duration.ofMinutes(2), List.of(), true);

    private final Map<ComplexityClass, List<PhaseSpec>> templates;
    private final Map<String, String> capabilityKeywords;
    private final Map<String, Double> complexityKeywords;
    private final Map<String, List<PatternSpec>> patterns;
    private final ScoringWeights weights;
    private final Set<String> phaseCapabilities;

    public StrategyCatalog(Map<ComplexityClass, List<PhaseSpec>> templates,
                           Map<String, String> capabilityKeywords,
                           Map<String, Double> complexityKeywords,
                           Map<String, List<PatternSpec>> patterns,
                           ScoringWeights weights) {
        var t = new EnumMap<ComplexityClass, List<PhaseSpec>>(ComplexityClass.class);
        templates.forEach((k, v) -> t.put(k, List.copyOf(v)));
        for (ComplexityClass c : ComplexityClass.values()) {
            if (!t.containsKey(c) || t.get(c).isEmpty()) {
                throw new IllegalArgumentException("No phase template for " + c);
            }
        }
        this.templates = Collections.unmodifiableMap(t);
        this.capabilityKeywords = Collections.unmodifiableMap(new LinkedHashMap<>(capabilityKeywords));
        this.complexityKeywords = Collections.unmodifiableMap(new LinkedHashMap<>(complexityKeywords));
        var p = new LinkedHashMap<String, List<PatternSpec>>();
        patterns.forEach((k, v) -> p.put(k, List.copyOf(v)));
        this.patterns = Collections.unmodifiableMap(p);
        this.weights = weights;
        var owned = new LinkedHashSet<String>();
        t.values().forEach(phases -> phases.stream()
                .filter(ph -> ph.capability() != null)
                .forEach(ph -> owned.add(ph.capability())));
        this.phaseCapabilities = Collections.unmodifiableSet(owned);
    }

    public static StrategyCatalog defaults() {
        return defaults(new PlannerProperties());
    }

    /**
     * The built-in tables, with keyword rules and scoring weights taken from
     * {@code properties}.
     */
    public static StrategyCatalog defaults(PlannerProperties properties) {
        var templates = new EnumMap<ComplexityClass, List<PhaseSpec>>(ComplexityClass.class);
        templates.put(ComplexityClass.SIMPLE, List.of(EXECUTE));
        templates.put(ComplexityClass.MODERATE, List.of(PREPARE, EXECUTE, VALIDATE));
        templates.put(ComplexityClass.COMPLEX, List.of(ANALYZE, PREPARE, EXECUTE, VALIDATE, REPORT));
        templates.put(ComplexityClass.VERY_COMPLEX,
                List.of(ANALYZE, DESIGN, PREPARE, EXECUTE, INTEGRATE, VALIDATE, REPORT));

        var keywords = new LinkedHashMap<String, String>();
        properties.getCapabilityKeywords().forEach((k, v) -> keywords.put(k.toLowerCase(Locale.ROOT), v));
        keywords.putIfAbsent("migrat", "file-write");
        keywords.putIfAbsent("file", "file-write");
        keywords.putIfAbsent("write", "file-write");
        keywords.putIfAbsent("copy", "file-write");
        keywords.putIfAbsent("validat", "validate");
        keywords.putIfAbsent("verif", "validate");
        keywords.putIfAbsent("test", "validate");
        keywords.putIfAbsent("check", "validate");
        keywords.putIfAbsent("analy", "analyze");
        keywords.putIfAbsent("research", "analyze");
        keywords.putIfAbsent("deploy", "deploy");
        keywords.putIfAbsent("build", "build");
        keywords.putIfAbsent("report", "report");
        keywords.putIfAbsent("summar", "report");

        var complexity = new LinkedHashMap<String, Double>();
        complexity.put("migrat", 1.0);
        complexity.put("validat", 1.0);
        complexity.put("integrat", 1.5);
        complexity.put("distribut", 1.5);
        complexity.put("architect", 2.0);
        complexity.put("design", 1.0);
        complexity.put("analy", 1.0);
        complexity.put("optimi", 1.0);
        complexity.put("refactor", 1.0);
        complexity.put("coordinat", 1.0);
        complexity.put("deploy", 1.0);
        complexity.put("security", 1.0);
        complexity.put("multiple", 0.5);

        var patterns = new LinkedHashMap<String, List<PatternSpec>>();
        patterns.put("file-write", List.of(
                new PatternSpec("file-write.sequential", ActionKind.SEQUENTIAL, 0.9, 1.0, Duration.ofMinutes(5)),
                new PatternSpec("file-write.parallel", ActionKind.PARALLEL, 0.8, 0.6, Duration.ofMinutes(3)),
                new PatternSpec("file-write.adaptive", ActionKind.ADAPTIVE, 0.75, 1.5, Duration.ofMinutes(6))));
        patterns.put("validate", List.of(
                new PatternSpec("validate.sequential", ActionKind.SEQUENTIAL, 0.95, 0.5, Duration.ofMinutes(2)),
                new PatternSpec("validate.adaptive", ActionKind.ADAPTIVE, 0.8, 1.0, Duration.ofMinutes(4))));
        patterns.put("analyze", List.of(
                new PatternSpec("analyze.adaptive", ActionKind.ADAPTIVE, 0.85, 1.2, Duration.ofMinutes(8)),
                new PatternSpec("analyze.sequential", ActionKind.SEQUENTIAL, 0.8, 1.0, Duration.ofMinutes(10))));
        patterns.put("report", List.of(
                new PatternSpec("report.sequential", ActionKind.SEQUENTIAL, 0.95, 0.3, Duration.ofMinutes(1))));

        return new StrategyCatalog(templates, keywords, complexity, patterns,
                new ScoringWeights(properties.getSuccessWeight(), properties.getCostWeight(),
                        properties.getDeadlineWeight()));
    }

    public List<PhaseSpec> phases(ComplexityClass complexity) {
        return templates.get(complexity);
    }

    /** Capability tags the description mentions, in table order. */
    public Set<String> capabilitiesMentioned(String description) {
        String text = description.toLowerCase(Locale.ROOT);
        var found = new LinkedHashSet<String>();
        capabilityKeywords.forEach((stem, capability) -> {
            if (text.contains(stem)) {
                found.add(capability);
            }
        });
        return found;
    }

    /**
     * The capability the objective's own work needs: the first mentioned capability
     * that no phase owns, else the first mentioned one, else {@link #GENERAL}.
     */
    public String primaryCapability(String description) {
        Set<String> mentioned = capabilitiesMentioned(description);
        return mentioned.stream()
                .filter(c -> !phaseCapabilities.contains(c))
                .findFirst()
                .orElse(mentioned.stream().findFirst().orElse(GENERAL));
    }

    public String capabilityFor(PhaseSpec phase, String primaryCapability) {
        return phase.capability() != null ? phase.capability() : primaryCapability;
    }

    /** Sum of the weights of the complexity keywords found in the description. */
    public double complexityKeywordScore(String description) {
        String text = description.toLowerCase(Locale.ROOT);
        return complexityKeywords.entrySet().stream()
                .filter(e -> text.contains(e.getKey()))
                .mapToDouble(Map.Entry::getValue)
                .sum();
    }

    /**
     * Candidate patterns for a capability. Capabilities without an entry get the three
     * generic shapes.
     */
    public List<PatternSpec> patternsFor(String capability) {
        List<PatternSpec> specific = patterns.get(capability);
        if (specific != null) {
            return specific;
        }
        return List.of(
                new PatternSpec(capability + ".sequential", ActionKind.SEQUENTIAL, 0.85, 1.0, Duration.ofMinutes(5)),
                new PatternSpec(capability + ".parallel", ActionKind.PARALLEL, 0.75, 0.7, Duration.ofMinutes(4)),
                new PatternSpec(capability + ".adaptive", ActionKind.ADAPTIVE, 0.7, 1.3, Duration.ofMinutes(6)));
    }

    /** Capability set a fallback unit requires instead of {@code capabilities}. */
    public Set<String> relax(Set<String> capabilities) {
        return Set.of(GENERAL);
    }

    public ScoringWeights weights() {
        return weights;
    }
}
