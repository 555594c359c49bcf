package com.concord.core.conflict;

import com.concord.core.model.Conflict;
import com.concord.core.model.ConflictingValue;
import com.concord.core.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Turns the reports of several agents about the same state into a classified
 * {@link Conflict}, or nothing when the reports are compatible.
 * <p>
 * Severity: disputes over plans or decisions, and reports where most fields disagree,
 * are HIGH; a single disputed field with nothing else reported is LOW; everything
 * else (some fields agree or do not overlap, some disagree) is MEDIUM.
 */
@Component
public class ConflictDetector {

    public Optional<Conflict> detect(String domain, List<ConflictingValue> reports) {
        if (reports == null || reports.size() < 2) {
            return Optional.empty();
        }
        Set<String> fields = new TreeSet<>();
        reports.forEach(r -> fields.addAll(r.fields().keySet()));
        Set<String> disputed = disputedFields(reports, fields);
        if (disputed.isEmpty()) {
            return Optional.empty();
        }
        Severity severity = classify(domain, fields.size(), disputed.size());
        return Optional.of(new Conflict(UUID.randomUUID().toString(), severity, domain, reports, Instant.now()));
    }

    /** Fields reported with more than one distinct value. */
    static Set<String> disputedFields(List<ConflictingValue> reports, Set<String> fields) {
        var disputed = new TreeSet<String>();
        for (String field : fields) {
            var seen = new HashSet<Object>();
            for (ConflictingValue report : reports) {
                if (report.fields().containsKey(field)) {
                    seen.add(report.fields().get(field));
                }
            }
            if (seen.size() > 1) {
                disputed.add(field);
            }
        }
        return disputed;
    }

    static Severity classify(String domain, int fieldCount, int disputedCount) {
        if (domain != null && (domain.startsWith("plan") || domain.startsWith("decision"))) {
            return Severity.HIGH;
        }
        if (fieldCount == 1) {
            return Severity.LOW;
        }
        if (disputedCount * 2 > fieldCount) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }
}
