package ai.lineage.hierarchy;

import ai.lineage.corpus.TaskRecord;
import ai.lineage.instructions.CandidateMatch;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Tie-break applied when several validated parents match a child's instruction. The index returns every match;
 * picking one is a product decision, so it is configurable.
 */
public enum ParentSelectionPolicy {
    /**
     * Prefer parents in the child's workspace, then the latest parent created at or before the child. When no
     * candidate precedes the child, take the earliest one.
     */
    NEAREST_PRECEDING {
        @Override
        public Optional<ScoredCandidate> choose(TaskRecord child, List<ScoredCandidate> candidates) {
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            var pool = sameWorkspaceOrAll(child, candidates);
            var childTime = child.createdAt();
            if (childTime == null) {
                return Optional.of(pool.get(0));
            }

            var preceding = pool.stream()
                    .filter(c -> c.createdAt() != null && !c.createdAt().isAfter(childTime))
                    .max(Comparator.comparing(c -> Objects.requireNonNull(c.createdAt())));
            if (preceding.isPresent()) {
                return preceding;
            }
            return pool.stream()
                    .min(Comparator.comparing(
                            ScoredCandidate::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder())));
        }
    },

    /** Keep only the strongest textual matches, then break remaining ties like {@link #NEAREST_PRECEDING}. */
    LONGEST_MATCH {
        @Override
        public Optional<ScoredCandidate> choose(TaskRecord child, List<ScoredCandidate> candidates) {
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            var strongest = candidates.stream()
                    .map(ScoredCandidate::match)
                    .min(CandidateMatch.STRONGEST_FIRST)
                    .orElseThrow();
            var top = candidates.stream()
                    .filter(c -> CandidateMatch.STRONGEST_FIRST.compare(c.match(), strongest) == 0)
                    .toList();
            return NEAREST_PRECEDING.choose(child, top);
        }
    },

    /** Accept a parent only when exactly one validated candidate remains. */
    AMBIGUOUS_UNRESOLVED {
        @Override
        public Optional<ScoredCandidate> choose(TaskRecord child, List<ScoredCandidate> candidates) {
            return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
        }
    };

    /** A validated candidate together with its corpus record. */
    public record ScoredCandidate(TaskRecord parent, CandidateMatch match) {
        public String parentTaskId() {
            return parent.taskId();
        }

        public @Nullable Instant createdAt() {
            return parent.createdAt();
        }
    }

    /**
     * Picks one parent among {@code candidates}, which arrive strongest match first.
     *
     * @return empty when no candidate is acceptable under this policy.
     */
    public abstract Optional<ScoredCandidate> choose(TaskRecord child, List<ScoredCandidate> candidates);

    private static List<ScoredCandidate> sameWorkspaceOrAll(TaskRecord child, List<ScoredCandidate> candidates) {
        var workspace = child.workspace();
        if (workspace == null) {
            return candidates;
        }
        var same = candidates.stream()
                .filter(c -> workspace.equals(c.parent().workspace()))
                .toList();
        return same.isEmpty() ? candidates : same;
    }
}
