package ai.lineage.instructions;

import java.util.Comparator;

/**
 * A tentative parent returned by a lookup.
 *
 * @param parentTaskId the task that registered the matching key.
 * @param matchedPrefixLength number of leading characters shared by both keys, i.e. the length of the shorter one.
 * @param kind which side of the comparison was the prefix.
 */
public record CandidateMatch(String parentTaskId, int matchedPrefixLength, MatchKind kind) {

    /** Longest match first; on equal length an exact match beats a truncated one. */
    public static final Comparator<CandidateMatch> STRONGEST_FIRST = Comparator.<CandidateMatch>comparingInt(
                    CandidateMatch::matchedPrefixLength)
            .reversed()
            .thenComparing(CandidateMatch::kind);

    public boolean isStrongerThan(CandidateMatch other) {
        return STRONGEST_FIRST.compare(this, other) < 0;
    }
}
