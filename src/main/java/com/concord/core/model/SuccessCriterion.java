package com.concord.core.model;

import java.io.Serializable;

/**
 * A condition the caller uses to judge that an objective was met.
 *
 * @param id          identifier unique within the objective
 * @param description what must hold once the objective completes
 */
public record SuccessCriterion(
    String id,
    String description
) implements Serializable {}
