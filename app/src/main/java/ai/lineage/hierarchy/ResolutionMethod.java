package ai.lineage.hierarchy;

/** How a task's parent was determined in phase 2. */
public enum ResolutionMethod {
    /** The persisted parent link was valid and kept. */
    PERSISTED,
    /** The persisted parent is outside the corpus and no instruction match replaced it; the link is kept as is. */
    PERSISTED_EXTERNAL,
    /** The parent was found through the instruction prefix index. */
    INSTRUCTION_MATCH,
    /** No parent: the task starts a hierarchy. */
    ROOT,
    /** Candidates existed but none could be chosen, or the task failed to process. */
    UNRESOLVED
}
