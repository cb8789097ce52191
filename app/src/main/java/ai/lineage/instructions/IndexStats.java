package ai.lineage.instructions;

/**
 * Diagnostic counters of an {@link InstructionPrefixIndex}.
 *
 * @param totalNodes distinct canonical keys.
 * @param totalInstructions (key, task id) registrations.
 * @param trieNodes allocated trie nodes, root included.
 */
public record IndexStats(int totalNodes, int totalInstructions, int trieNodes) {

    public double averageParentsPerKey() {
        return totalNodes == 0 ? 0.0 : (double) totalInstructions / totalNodes;
    }
}
