package ai.lineage.corpus;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One task as supplied by the conversation loader.
 *
 * @param taskId stable, unique identifier of the task.
 * @param instruction the raw instruction the task was created with. May contain markdown or tool-call markup. Also
 *     read from {@code truncatedInstruction}, the field name used by conversation skeleton caches.
 * @param parentTaskId the parent link persisted by the host, if any. It may be stale or point outside the corpus.
 * @param workspace the workspace the task ran in, if known.
 * @param createdAt creation time of the task, if known.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskRecord(
        String taskId,
        @JsonAlias("truncatedInstruction") @Nullable String instruction,
        @Nullable String parentTaskId,
        @Nullable String workspace,
        @Nullable Instant createdAt) {

    public TaskRecord {
        Objects.requireNonNull(taskId, "taskId");
        if (taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
    }

    public TaskRecord(String taskId, @Nullable String instruction) {
        this(taskId, instruction, null, null, null);
    }

    @JsonIgnore
    public boolean hasInstruction() {
        return instruction != null && !instruction.isBlank();
    }

    @JsonIgnore
    public boolean hasPersistedParent() {
        return parentTaskId != null && !parentTaskId.isBlank();
    }

    public TaskRecord withParentTaskId(@Nullable String newParentTaskId) {
        return new TaskRecord(taskId, instruction, newParentTaskId, workspace, createdAt);
    }
}
