package com.concord.core.strategy;

import com.concord.core.model.ActionKind;

import java.time.Duration;

/**
 * A workflow pattern the catalog offers for a capability.
 *
 * @param patternId       id the workflow-pattern executor knows the pattern by
 * @param kind            execution shape
 * @param baseSuccess     prior success probability, before history is blended in
 * @param resourceCost    relative cost, 1.0 = typical
 * @param typicalDuration how long the pattern usually takes
 */
public record PatternSpec(
    String patternId,
    ActionKind kind,
    double baseSuccess,
    double resourceCost,
    Duration typicalDuration
) {}
