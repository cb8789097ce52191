package ai.lineage.instructions;

/** How a registered key relates to the key being looked up. */
public enum MatchKind {
    /** Both keys are identical. */
    EXACT,
    /** The looked-up key is a strict prefix of the registered key (the child side was cut shorter). */
    CANDIDATE_PREFIX,
    /** The registered key is a strict prefix of the looked-up key (the parent's quote was cut shorter). */
    REGISTERED_PREFIX
}
