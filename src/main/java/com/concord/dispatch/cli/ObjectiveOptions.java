package com.concord.dispatch.cli;

import com.concord.core.error.ValidationException;
import com.concord.core.model.Constraint;
import com.concord.core.model.ConstraintKind;
import com.concord.core.model.Objective;
import com.concord.core.model.Priority;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Objective arguments shared by {@code plan} and {@code run}.
 */
public class ObjectiveOptions {

    @Parameters(index = "0", description = "What the objective should achieve")
    String description;

    @Option(names = {"--priority", "-p"}, description = "LOW, NORMAL, HIGH or CRITICAL", defaultValue = "NORMAL")
    String priority;

    @Option(names = {"--within", "-w"}, description = "Deadline relative to now, e.g. PT10M")
    Duration within;

    @Option(names = {"--require", "-r"}, description = "Capability some agent must declare (repeatable)")
    List<String> required = new ArrayList<>();

    @Option(names = {"--max-tasks"}, description = "Upper bound on the number of task units")
    Integer maxTasks;

    /**
     * @throws ValidationException if the priority is unknown
     */
    Objective toObjective() {
        Priority p;
        try {
            p = Priority.valueOf(priority.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid priority: " + priority + ". Valid: LOW, NORMAL, HIGH, CRITICAL");
        }
        var constraints = new ArrayList<Constraint>();
        for (String capability : required) {
            constraints.add(new Constraint("k" + (constraints.size() + 1), ConstraintKind.REQUIRED_CAPABILITY,
                    capability, true));
        }
        if (maxTasks != null) {
            constraints.add(new Constraint("k" + (constraints.size() + 1), ConstraintKind.MAX_TASKS,
                    String.valueOf(maxTasks), true));
        }
        Instant deadline = within != null ? Instant.now().plus(within) : null;
        return new Objective("obj-" + UUID.randomUUID().toString().substring(0, 8), description, p, deadline,
                List.of(), constraints, List.of());
    }
}
