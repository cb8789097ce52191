package ai.lineage.testutil;

import ai.lineage.corpus.TaskCorpus;
import ai.lineage.corpus.TaskRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Small builders for task corpora used across tests. */
public final class TaskFixtures {
    public static final Instant T0 = Instant.parse("2025-01-15T09:00:00Z");
    public static final String WORKSPACE = "/work/project";

    private TaskFixtures() {}

    /** A task in {@link #WORKSPACE} created {@code minute} minutes after {@link #T0}. */
    public static TaskRecord task(String id, @Nullable String instruction, int minute) {
        return new TaskRecord(id, instruction, null, WORKSPACE, at(minute));
    }

    public static TaskRecord task(
            String id, @Nullable String instruction, @Nullable String parentId, @Nullable String workspace, int minute) {
        return new TaskRecord(id, instruction, parentId, workspace, at(minute));
    }

    public static Instant at(int minute) {
        return T0.plus(Duration.ofMinutes(minute));
    }

    public static TaskCorpus corpus(TaskRecord... tasks) {
        return TaskCorpus.of(List.of(tasks));
    }

    /** An orchestrator instruction handing each message to a sub-task through numbered steps. */
    public static String delegating(String... messages) {
        var sb = new StringBuilder("Plan for this session.\n\n");
        for (int i = 0; i < messages.length; i++) {
            sb.append(i + 1)
                    .append(". Create a subtask with **Message:** \"")
                    .append(messages[i])
                    .append("\"\n");
        }
        return sb.toString();
    }
}
