package com.concord.core.planner;

import com.concord.core.model.ContingencyPlan;
import com.concord.core.model.RiskAssessment;
import com.concord.core.model.TaskUnit;
import com.concord.core.strategy.StrategyCatalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Prepares a fallback unit for every task whose risk exceeds the threshold. The
 * fallback keeps the task's place in the plan, asks for a relaxed capability set and
 * is given twice the time.
 */
public class ContingencyPlanner {

    private final StrategyCatalog catalog;

    public ContingencyPlanner(StrategyCatalog catalog) {
        this.catalog = catalog;
    }

    public List<ContingencyPlan> prepare(List<TaskUnit> tasks, RiskAssessment risk, double threshold) {
        var contingencies = new ArrayList<ContingencyPlan>();
        for (TaskUnit task : tasks) {
            double taskRisk = risk.riskOf(task.id());
            if (taskRisk <= threshold) {
                continue;
            }
            var fallback = new TaskUnit(task.id() + "-FB", task.planId(), task.phase(),
                    "fallback for " + task.description(),
                    catalog.relax(task.requiredCapabilities()),
                    task.estimatedDuration().multipliedBy(2),
                    task.preconditions(),
                    task.expectedOutcome(),
                    task.timeout() != null ? task.timeout().multipliedBy(2) : null);
            contingencies.add(new ContingencyPlan("CP-" + task.id(), task.id(),
                    String.format("task %s fails or finds no capable agent (risk %.2f)", task.id(), taskRisk),
                    fallback));
        }
        return contingencies;
    }
}
