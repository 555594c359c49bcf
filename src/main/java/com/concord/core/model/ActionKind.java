package com.concord.core.model;

/**
 * Execution shape of a workflow pattern.
 */
public enum ActionKind {
    /** Steps run one after another. */
    SEQUENTIAL,
    /** Independent steps fan out and join. */
    PARALLEL,
    /** Steps are chosen on the fly from intermediate results. */
    ADAPTIVE
}
