package com.concord.core.model;

import java.io.Serializable;

/**
 * A restriction on how an objective may be decomposed and executed.
 *
 * @param id        identifier unique within the objective
 * @param kind      what is being restricted
 * @param value     kind-specific operand (capability tag, task count or ISO-8601 duration)
 * @param mandatory mandatory constraints make planning fail when violated; optional ones
 *                  only raise the plan's risk
 */
public record Constraint(
    String id,
    ConstraintKind kind,
    String value,
    boolean mandatory
) implements Serializable {
}
