package ai.lineage.instructions;

/**
 * Bounded-length comparison key derived from an instruction by {@link InstructionKeys#computeCanonicalKey}.
 * The empty key stands for "no instruction" and never matches anything, including another empty key.
 */
public record CanonicalKey(String value) {
    public static final CanonicalKey EMPTY = new CanonicalKey("");

    public int length() {
        return value.length();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /** True if this key is a strict prefix of {@code other}. Empty keys are never prefixes. */
    public boolean isStrictPrefixOf(CanonicalKey other) {
        return !isEmpty() && other.length() > length() && other.value.startsWith(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
