package com.concord.core.model;

import java.io.Serializable;

/**
 * Fallback prepared for a high-risk task unit.
 *
 * @param id               contingency id
 * @param taskId           the task unit it covers
 * @param triggerCondition when the fallback should replace the original
 * @param fallback         the replacement unit
 */
public record ContingencyPlan(
    String id,
    String taskId,
    String triggerCondition,
    TaskUnit fallback
) implements Serializable {}
