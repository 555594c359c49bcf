package com.concord.core.decision;

import com.concord.core.model.Decision;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only decision log of one task execution. Entries are never replaced or
 * removed; backtracking is recorded as a new entry.
 */
public class DecisionLog {

    private final String taskId;
    private final List<Decision> entries = new ArrayList<>();

    public DecisionLog(String taskId) {
        this.taskId = taskId;
    }

    /**
     * @throws IllegalArgumentException if the decision belongs to another task
     */
    public synchronized Decision append(Decision decision) {
        if (!taskId.equals(decision.taskId())) {
            throw new IllegalArgumentException("Decision for " + decision.taskId() + " appended to log of " + taskId);
        }
        entries.add(decision);
        return decision;
    }

    public synchronized List<Decision> entries() {
        return List.copyOf(entries);
    }

    public synchronized Optional<Decision> last() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    public synchronized int size() {
        return entries.size();
    }

    public String taskId() {
        return taskId;
    }
}
