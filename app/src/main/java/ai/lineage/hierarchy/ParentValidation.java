package ai.lineage.hierarchy;

import ai.lineage.corpus.TaskCorpus;
import ai.lineage.corpus.TaskRecord;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of checking a proposed child-to-parent edge against the corpus and the edges accepted so far.
 *
 * @param reason why the edge was rejected; null when valid.
 */
public record ParentValidation(boolean valid, @Nullable Rejection rejection, @Nullable String reason) {

    public enum Rejection {
        MISSING_PARENT,
        SELF_REFERENCE,
        CYCLE,
        CREATED_AFTER_CHILD,
        WORKSPACE_MISMATCH
    }

    private static final ParentValidation VALID = new ParentValidation(true, null, null);

    public static ParentValidation ok() {
        return VALID;
    }

    public static ParentValidation rejected(Rejection rejection, String reason) {
        return new ParentValidation(false, rejection, reason);
    }

    /** Runs every check in order and reports the first failure. */
    public static ParentValidation check(
            TaskRecord child, String parentTaskId, TaskCorpus corpus, ResolvedEdges edges, boolean requireSameWorkspace) {
        if (child.taskId().equals(parentTaskId)) {
            return rejected(Rejection.SELF_REFERENCE, "task cannot be its own parent");
        }
        var parent = corpus.get(parentTaskId).orElse(null);
        if (parent == null) {
            return rejected(Rejection.MISSING_PARENT, "parent " + parentTaskId + " is not in the corpus");
        }
        if (edges.wouldCreateCycle(child.taskId(), parentTaskId)) {
            return rejected(Rejection.CYCLE, "parent " + parentTaskId + " descends from " + child.taskId());
        }
        var parentTime = parent.createdAt();
        var childTime = child.createdAt();
        if (parentTime != null && childTime != null && parentTime.isAfter(childTime)) {
            return rejected(Rejection.CREATED_AFTER_CHILD, "parent " + parentTaskId + " was created after the child");
        }
        if (requireSameWorkspace
                && parent.workspace() != null
                && child.workspace() != null
                && !parent.workspace().equals(child.workspace())) {
            return rejected(
                    Rejection.WORKSPACE_MISMATCH,
                    "workspace %s differs from %s".formatted(parent.workspace(), child.workspace()));
        }
        return ok();
    }
}
