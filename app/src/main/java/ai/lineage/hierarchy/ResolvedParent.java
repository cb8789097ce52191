package ai.lineage.hierarchy;

import ai.lineage.instructions.CandidateMatch;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Phase 2 outcome for one task.
 *
 * @param parentTaskId the chosen parent, null for roots and unresolved tasks.
 * @param candidates the validated candidates the choice was made from; empty unless instruction matching ran.
 * @param note short human-readable explanation, e.g. why a persisted link was discarded.
 */
public record ResolvedParent(
        String taskId,
        @Nullable String parentTaskId,
        ResolutionMethod method,
        List<CandidateMatch> candidates,
        @Nullable String note) {

    public ResolvedParent {
        candidates = List.copyOf(candidates);
    }

    public boolean hasParent() {
        return parentTaskId != null;
    }
}
