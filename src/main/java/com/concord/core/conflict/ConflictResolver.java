package com.concord.core.conflict;

import com.concord.core.concurrent.CancellationToken;
import com.concord.core.consensus.ConsensusCoordinator;
import com.concord.core.error.ValidationException;
import com.concord.core.knowledge.KnowledgeStore;
import com.concord.core.knowledge.KnowledgeStoreException;
import com.concord.core.metrics.CoordinationMetrics;
import com.concord.core.model.Conflict;
import com.concord.core.model.ConflictingValue;
import com.concord.core.model.ConsensusResult;
import com.concord.core.model.Resolution;
import com.concord.core.model.ResolutionStrategy;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Settles conflicts according to their severity.
 * <ul>
 *   <li>LOW: last writer wins by report timestamp, ties to the lowest agent id.</li>
 *   <li>MEDIUM: agreeing and non-overlapping fields are merged; only the disputed
 *       fields are put to the reporting agents, falling back to last writer wins at
 *       lower confidence.</li>
 *   <li>HIGH: each candidate value is proposed in order of support; the first value a
 *       quorum commits is the resolution.</li>
 * </ul>
 * Each conflict is resolved exactly once; later calls return the recorded resolution.
 * Only the most recent resolutions are kept in memory, older ones live on in the
 * knowledge store.
 */
@Service
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    static final double LWW_CONFIDENCE = 0.9;
    static final double LWW_TIE_CONFIDENCE = 0.6;
    static final double MERGED_CONFIDENCE = 1.0;
    static final double FALLBACK_CONFIDENCE = 0.5;

    static final int RETAINED_RESOLUTIONS = 4096;
    static final Duration RESOLUTION_TTL = Duration.ofHours(1);

    private final ConsensusCoordinator consensus;
    private final KnowledgeStore knowledgeStore;
    private final CoordinationMetrics metrics;
    // failed resolutions are dropped, so the conflict can be resolved again
    private final AsyncCache<String, Resolution> resolutions;

    @Autowired
    public ConflictResolver(ConsensusCoordinator consensus,
                            @Autowired(required = false) KnowledgeStore knowledgeStore,
                            @Autowired(required = false) CoordinationMetrics metrics) {
        this(consensus, knowledgeStore, metrics, RETAINED_RESOLUTIONS);
    }

    ConflictResolver(ConsensusCoordinator consensus, KnowledgeStore knowledgeStore, CoordinationMetrics metrics,
                     int retained) {
        this.consensus = consensus;
        this.knowledgeStore = knowledgeStore;
        this.metrics = metrics;
        this.resolutions = Caffeine.newBuilder()
                .maximumSize(retained)
                .expireAfterWrite(RESOLUTION_TTL)
                .buildAsync();
    }

    public ConflictResolver(ConsensusCoordinator consensus) {
        this(consensus, null, null);
    }

    public Resolution resolve(Conflict conflict) {
        return resolve(conflict, CancellationToken.none());
    }

    /**
     * Resolves {@code conflict}, or returns its recorded resolution.
     *
     * @throws ValidationException if the conflict carries no values
     */
    public Resolution resolve(Conflict conflict, CancellationToken token) {
        if (conflict.values().isEmpty()) {
            throw new ValidationException("Conflict " + conflict.id() + " has no values");
        }
        var mine = new CompletableFuture<Resolution>();
        CompletableFuture<Resolution> existing = resolutions.asMap().putIfAbsent(conflict.id(), mine);
        if (existing != null) {
            return existing.join();
        }
        try {
            Resolution resolution = switch (conflict.severity()) {
                case LOW -> lastWriterWins(conflict);
                case MEDIUM -> merge(conflict, token);
                case HIGH -> byConsensus(conflict, token);
            };
            log.info("Conflict {} ({}, {}) resolved by {} with confidence {}", conflict.id(), conflict.severity(),
                    conflict.domain(), resolution.strategy(), String.format("%.2f", resolution.confidence()));
            record(conflict, resolution);
            mine.complete(resolution);
            return resolution;
        } catch (RuntimeException e) {
            resolutions.asMap().remove(conflict.id(), mine);
            mine.completeExceptionally(e);
            throw e;
        }
    }

    public Optional<Resolution> find(String conflictId) {
        CompletableFuture<Resolution> f = resolutions.getIfPresent(conflictId);
        return f != null && f.isDone() && !f.isCompletedExceptionally() ? Optional.of(f.join()) : Optional.empty();
    }

    public List<Resolution> resolutions() {
        return resolutions.asMap().values().stream()
                .filter(f -> f.isDone() && !f.isCompletedExceptionally())
                .map(CompletableFuture::join)
                .sorted(Comparator.comparing(Resolution::resolvedAt))
                .toList();
    }

    private Resolution lastWriterWins(Conflict conflict) {
        ConflictingValue winner = latest(conflict.values());
        boolean tied = conflict.values().stream()
                .filter(v -> v != winner)
                .anyMatch(v -> v.timestamp().equals(winner.timestamp()));
        return new Resolution(conflict.id(), ResolutionStrategy.LAST_WRITER_WINS, winner.fields(),
                tied ? LWW_TIE_CONFIDENCE : LWW_CONFIDENCE,
                "latest report from " + winner.sourceAgent() + (tied ? " (timestamp tie, lowest agent id)" : ""),
                List.of(), Instant.now());
    }

    private Resolution merge(Conflict conflict, CancellationToken token) {
        Set<String> fields = new TreeSet<>();
        conflict.values().forEach(v -> fields.addAll(v.fields().keySet()));
        Set<String> disputed = ConflictDetector.disputedFields(conflict.values(), fields);

        var merged = new TreeMap<String, Object>();
        for (String field : fields) {
            if (!disputed.contains(field)) {
                conflict.values().stream()
                        .filter(v -> v.fields().containsKey(field))
                        .findFirst()
                        .ifPresent(v -> merged.put(field, v.fields().get(field)));
            }
        }

        if (disputed.isEmpty()) {
            return new Resolution(conflict.id(), ResolutionStrategy.MERGE, merged, MERGED_CONFIDENCE,
                    "reports are compatible, merged " + fields.size() + " field(s)", List.of(), Instant.now());
        }
        var candidate = new TreeMap<String, Object>();
        for (String field : disputed) {
            candidate.put(field, mostSupported(conflict.values(), field));
        }
        double disputedConfidence;
        String how;
        ConsensusResult result = consensus.propose(sources(conflict), candidate, token);
        if (result.accepted()) {
            merged.putAll(result.committedValue());
            disputedConfidence = (double) result.acceptances() / sources(conflict).size();
            how = "consensus " + result.acceptances() + "/" + sources(conflict).size();
        } else {
            ConflictingValue latest = latest(conflict.values());
            for (String field : disputed) {
                Object value = latestValueOf(conflict.values(), field);
                merged.put(field, value != null ? value : latest.fields().get(field));
            }
            disputedConfidence = FALLBACK_CONFIDENCE;
            how = "last writer wins after consensus " + result.outcome().name().toLowerCase() + " (" + result.reason() + ")";
        }
        double confidence = (MERGED_CONFIDENCE * (fields.size() - disputed.size())
                + disputedConfidence * disputed.size()) / fields.size();
        return new Resolution(conflict.id(), ResolutionStrategy.MERGE, merged, confidence,
                "merged " + (fields.size() - disputed.size()) + " field(s); disputed " + disputed + " settled by " + how,
                List.copyOf(disputed), Instant.now());
    }

    private Resolution byConsensus(Conflict conflict, CancellationToken token) {
        List<String> voters = sources(conflict);
        for (Map<String, Object> candidate : candidatesBySupport(conflict.values())) {
            if (token.isCancelled()) {
                break;
            }
            ConsensusResult result = consensus.propose(voters, candidate, token);
            if (result.accepted()) {
                return new Resolution(conflict.id(), ResolutionStrategy.CONSENSUS, result.committedValue(),
                        (double) result.acceptances() / voters.size(),
                        "quorum committed value in term " + result.term(), List.of(), Instant.now());
            }
            log.debug("Candidate for conflict {} not committed: {}", conflict.id(), result.reason());
        }
        ConflictingValue winner = latest(conflict.values());
        return new Resolution(conflict.id(), ResolutionStrategy.LAST_WRITER_WINS, winner.fields(),
                FALLBACK_CONFIDENCE * LWW_TIE_CONFIDENCE,
                "no candidate reached quorum; latest report from " + winner.sourceAgent(),
                List.copyOf(winner.fields().keySet()), Instant.now());
    }

    private void record(Conflict conflict, Resolution resolution) {
        if (metrics != null) {
            metrics.recordConflictResolution(conflict.severity().name(), resolution.strategy().name());
        }
        if (knowledgeStore != null) {
            try {
                knowledgeStore.saveResolution(conflict, resolution);
            } catch (KnowledgeStoreException e) {
                log.warn("Could not store resolution of conflict {}: {}", conflict.id(), e.getMessage());
            }
        }
    }

    private static List<String> sources(Conflict conflict) {
        return conflict.values().stream().map(ConflictingValue::sourceAgent).distinct().sorted().toList();
    }

    // newest timestamp; among equal timestamps the lowest agent id
    static ConflictingValue latest(List<ConflictingValue> values) {
        return values.stream()
                .max(Comparator.comparing(ConflictingValue::timestamp)
                        .thenComparing(ConflictingValue::sourceAgent, Comparator.reverseOrder()))
                .orElseThrow();
    }

    private static Object latestValueOf(List<ConflictingValue> values, String field) {
        var reporting = values.stream().filter(v -> v.fields().containsKey(field)).toList();
        return reporting.isEmpty() ? null : latest(reporting).fields().get(field);
    }

    /** Value of {@code field} reported by most agents; ties go to the most recent report. */
    private static Object mostSupported(List<ConflictingValue> values, String field) {
        var support = new HashMap<Object, Integer>();
        values.stream().filter(v -> v.fields().containsKey(field))
                .forEach(v -> support.merge(v.fields().get(field), 1, Integer::sum));
        int best = support.values().stream().max(Integer::compare).orElse(0);
        var leaders = values.stream()
                .filter(v -> v.fields().containsKey(field) && support.get(v.fields().get(field)) == best)
                .toList();
        return latest(leaders).fields().get(field);
    }

    /** Distinct reported values, most supported first, then most recent. */
    private static List<Map<String, Object>> candidatesBySupport(List<ConflictingValue> values) {
        Map<Map<String, Object>, List<ConflictingValue>> byValue = values.stream()
                .collect(Collectors.groupingBy(ConflictingValue::fields, LinkedHashMap::new, Collectors.toList()));
        var ordered = new ArrayList<>(byValue.entrySet());
        ordered.sort(Comparator.<Map.Entry<Map<String, Object>, List<ConflictingValue>>>comparingInt(
                        e -> e.getValue().size()).reversed()
                .thenComparing(e -> latest(e.getValue()).timestamp(), Comparator.reverseOrder()));
        return ordered.stream().map(Map.Entry::getKey).toList();
    }
}
