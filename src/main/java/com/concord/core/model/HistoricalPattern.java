package com.concord.core.model;

import java.io.Serializable;

/**
 * Aggregated outcome history for a pattern in a given context, as returned by the
 * knowledge store.
 *
 * @param context     context key (capability tag or objective keyword)
 * @param patternId   workflow pattern id
 * @param successRate observed success rate 0..1
 * @param samples     number of recorded outcomes
 */
public record HistoricalPattern(
    String context,
    String patternId,
    double successRate,
    int samples
) implements Serializable {}
