package com.concord.dispatch.api;

import com.concord.core.error.ValidationException;
import com.concord.core.model.Constraint;
import com.concord.core.model.ConstraintKind;
import com.concord.core.model.Objective;
import com.concord.core.model.Priority;
import com.concord.core.model.SuccessCriterion;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Inbound JSON body for POST /api/v1/plans.
 *
 * @param id              objective id; nullable, generated when absent
 * @param description     what the objective should achieve
 * @param priority        LOW, NORMAL, HIGH or CRITICAL; nullable, defaults to NORMAL
 * @param deadline        absolute deadline; nullable
 * @param successCriteria criteria descriptions, numbered in order
 * @param constraints     constraints on the plan
 * @param subObjectives   nested objectives, planned in order before the parent's own work
 */
public record ObjectiveRequest(
    String id,
    String description,
    String priority,
    Instant deadline,
    @JsonProperty("success_criteria") List<String> successCriteria,
    List<ConstraintRequest> constraints,
    @JsonProperty("sub_objectives") List<ObjectiveRequest> subObjectives
) {

    /**
     * @param kind      REQUIRED_CAPABILITY, EXCLUDED_CAPABILITY, MAX_TASKS or MAX_DURATION
     * @param value     capability tag, count or ISO-8601 duration depending on kind
     * @param mandatory whether violating it makes the objective infeasible; defaults to true
     */
    public record ConstraintRequest(String kind, String value, Boolean mandatory) {}

    public static ObjectiveRequest of(String description) {
        return new ObjectiveRequest(null, description, null, null, null, null, null);
    }

    /**
     * Converts to the domain objective.
     *
     * @throws ValidationException if an enum value is unknown
     */
    public Objective toObjective() {
        String objectiveId = id != null && !id.isBlank() ? id : "obj-" + UUID.randomUUID().toString().substring(0, 8);
        Priority p = priority != null ? parse(Priority.class, priority, "priority") : Priority.NORMAL;

        var criteria = new ArrayList<SuccessCriterion>();
        if (successCriteria != null) {
            for (int i = 0; i < successCriteria.size(); i++) {
                criteria.add(new SuccessCriterion("c" + (i + 1), successCriteria.get(i)));
            }
        }
        var converted = new ArrayList<Constraint>();
        if (constraints != null) {
            for (int i = 0; i < constraints.size(); i++) {
                ConstraintRequest c = constraints.get(i);
                if (c.kind() == null) {
                    throw new ValidationException("Constraint " + (i + 1) + " has no kind");
                }
                converted.add(new Constraint("k" + (i + 1), parse(ConstraintKind.class, c.kind(), "constraint kind"),
                        c.value(), c.mandatory() == null || c.mandatory()));
            }
        }
        var children = new ArrayList<Objective>();
        if (subObjectives != null) {
            for (int i = 0; i < subObjectives.size(); i++) {
                ObjectiveRequest child = subObjectives.get(i);
                ObjectiveRequest named = child.id() != null ? child : new ObjectiveRequest(objectiveId + "." + (i + 1),
                        child.description(), child.priority(), child.deadline(), child.successCriteria(),
                        child.constraints(), child.subObjectives());
                children.add(named.toObjective());
            }
        }
        return new Objective(objectiveId, description, p, deadline, criteria, converted, children);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + what + ": " + value);
        }
    }
}
