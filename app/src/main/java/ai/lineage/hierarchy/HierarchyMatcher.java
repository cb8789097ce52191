package ai.lineage.hierarchy;

import ai.lineage.LineageConfig;
import ai.lineage.instructions.CandidateMatch;
import ai.lineage.instructions.InstructionKeys;
import ai.lineage.instructions.InstructionPrefixIndex;
import ai.lineage.instructions.SubInstructionExtractor;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Registers parents' quoted sub-instructions in an {@link InstructionPrefixIndex} and looks children up in it.
 *
 * <p>One matcher, index and edge graph belong to a single reconstruction pass. All registrations must happen before
 * the first lookup.
 */
public final class HierarchyMatcher {
    private static final Logger logger = LogManager.getLogger(HierarchyMatcher.class);

    private final InstructionPrefixIndex index;
    private final ResolvedEdges edges;
    private final LineageConfig config;

    public HierarchyMatcher(InstructionPrefixIndex index, ResolvedEdges edges, LineageConfig config) {
        this.index = index;
        this.edges = edges;
        this.config = config;
    }

    /** A matcher over a fresh index sized from {@code config}. */
    public static HierarchyMatcher forPass(LineageConfig config) {
        return new HierarchyMatcher(
                new InstructionPrefixIndex(config.maxKeyLength(), config.minPrefixLength()),
                new ResolvedEdges(),
                config);
    }

    public InstructionPrefixIndex index() {
        return index;
    }

    public ResolvedEdges edges() {
        return edges;
    }

    public int addParentTaskWithSubInstructions(String parentTaskId, @Nullable String parentText) {
        return addParentTaskWithSubInstructions(parentTaskId, parentText, config.maxKeyLength());
    }

    /**
     * Extracts the sub-instructions quoted in {@code parentText} and registers each under {@code parentTaskId}.
     *
     * <p>If nothing is extracted and {@link LineageConfig#registerFullTextFallback()} is set, the key of the whole
     * text is registered instead, so a child whose instruction copies the parent's verbatim still matches.
     *
     * @return number of keys registered for this parent by this call; 1 when the fallback was used.
     */
    public int addParentTaskWithSubInstructions(String parentTaskId, @Nullable String parentText, int maxLength) {
        if (parentText == null || parentText.isBlank()) {
            return 0;
        }

        int registered = 0;
        for (var subInstruction : SubInstructionExtractor.extractSubInstructions(parentText)) {
            var key = InstructionKeys.computeCanonicalKey(subInstruction, maxLength);
            if (!key.isEmpty()) {
                index.addInstruction(parentTaskId, key, subInstruction);
                registered++;
            }
        }

        if (registered == 0 && config.registerFullTextFallback()) {
            var key = InstructionKeys.computeCanonicalKey(parentText, maxLength);
            if (!key.isEmpty()) {
                index.addInstruction(parentTaskId, key, parentText);
                logger.debug("No sub-instruction in {}; registered its full text", parentTaskId);
                return 1;
            }
        }
        logger.debug("Registered {} sub-instruction(s) for {}", registered, parentTaskId);
        return registered;
    }

    public List<CandidateMatch> resolveParent(String childTaskId, @Nullable String childText) {
        return resolveParent(childTaskId, childText, config.maxKeyLength());
    }

    /**
     * Candidate parents of {@code childTaskId}, strongest first. The child itself and its known descendants are
     * never returned.
     */
    public List<CandidateMatch> resolveParent(String childTaskId, @Nullable String childText, int maxLength) {
        var matches = index.searchExactPrefix(childText, maxLength);
        if (matches.isEmpty()) {
            return matches;
        }
        var descendants = edges.descendantsOf(childTaskId);
        var filtered = matches.stream()
                .filter(m -> !m.parentTaskId().equals(childTaskId))
                .filter(m -> !descendants.contains(m.parentTaskId()))
                .toList();
        if (filtered.size() != matches.size()) {
            logger.debug(
                    "Dropped {} self/descendant candidate(s) for {}", matches.size() - filtered.size(), childTaskId);
        }
        return filtered;
    }

    /** Records an accepted edge; refused if it would make the hierarchy cyclic. */
    public boolean acceptParent(String childTaskId, String parentTaskId) {
        boolean accepted = edges.accept(childTaskId, parentTaskId);
        if (!accepted) {
            logger.debug("Refused edge {} -> {}: would create a cycle", childTaskId, parentTaskId);
        }
        return accepted;
    }
}
