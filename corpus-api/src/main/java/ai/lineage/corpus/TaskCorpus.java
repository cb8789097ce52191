package ai.lineage.corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The fixed set of tasks processed by one reconstruction pass. Iteration follows the order in which the loader
 * supplied the records.
 */
public final class TaskCorpus implements Iterable<TaskRecord> {
    private static final Logger logger = LogManager.getLogger(TaskCorpus.class);

    private final Map<String, TaskRecord> tasksById;

    private TaskCorpus(Map<String, TaskRecord> tasksById) {
        this.tasksById = Collections.unmodifiableMap(tasksById);
    }

    public static TaskCorpus empty() {
        return new TaskCorpus(new LinkedHashMap<>());
    }

    /** Builds a corpus, keeping the first record when an id appears more than once. */
    public static TaskCorpus of(Iterable<TaskRecord> records) {
        var byId = new LinkedHashMap<String, TaskRecord>();
        for (var record : records) {
            var previous = byId.putIfAbsent(record.taskId(), record);
            if (previous != null) {
                logger.warn("Duplicate task id {} in corpus; keeping the first record", record.taskId());
            }
        }
        return new TaskCorpus(byId);
    }

    public Optional<TaskRecord> get(String taskId) {
        return Optional.ofNullable(tasksById.get(taskId));
    }

    public boolean contains(String taskId) {
        return tasksById.containsKey(taskId);
    }

    public int size() {
        return tasksById.size();
    }

    public boolean isEmpty() {
        return tasksById.isEmpty();
    }

    /** Returns the ids of every task in corpus order. */
    public List<String> taskIds() {
        return new ArrayList<>(tasksById.keySet());
    }

    @Override
    public Iterator<TaskRecord> iterator() {
        return tasksById.values().iterator();
    }
}
