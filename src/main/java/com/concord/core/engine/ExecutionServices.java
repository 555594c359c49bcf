package com.concord.core.engine;

import com.concord.core.conflict.ConflictDetector;
import com.concord.core.conflict.ConflictResolver;
import com.concord.core.decision.SequentialDecisionEngine;
import com.concord.core.distribution.TaskDistributor;
import com.concord.core.events.EventBus;
import com.concord.core.knowledge.KnowledgeStore;
import com.concord.core.messaging.ResilientMessenger;
import com.concord.core.metrics.CoordinationMetrics;
import com.concord.core.model.TaskAssignment;
import com.concord.core.registry.AgentRegistry;

import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Collaborators shared by every {@link PlanExecution}. {@code knowledgeStore} and
 * {@code metrics} may be null.
 *
 * @param router hands an assignment made for another plan's unit to that plan's execution
 */
record ExecutionServices(
    CoordinationProperties properties,
    AgentRegistry registry,
    TaskDistributor distributor,
    DependencyScheduler scheduler,
    SequentialDecisionEngine engine,
    ResilientMessenger messenger,
    ConflictDetector detector,
    ConflictResolver resolver,
    EventBus eventBus,
    KnowledgeStore knowledgeStore,
    CoordinationMetrics metrics,
    ExecutorService taskPool,
    Consumer<TaskAssignment> router
) {}
