package ai.lineage.instructions;

import org.jetbrains.annotations.Nullable;

/** Derives canonical comparison keys from raw instruction text. */
public final class InstructionKeys {
    public static final int DEFAULT_MAX_LENGTH = 192;

    private static final char BOM = '\uFEFF';

    private InstructionKeys() {
        // utility
    }

    public static CanonicalKey computeCanonicalKey(@Nullable String text) {
        return computeCanonicalKey(text, DEFAULT_MAX_LENGTH);
    }

    /**
     * Normalizes line breaks to {@code \n}, drops a leading byte-order mark and truncates to {@code maxLength}
     * characters. Spacing is otherwise preserved because keys are compared character by character.
     *
     * <p>Blank input yields {@link CanonicalKey#EMPTY}.
     *
     * @throws IllegalArgumentException if {@code maxLength} is not positive
     */
    public static CanonicalKey computeCanonicalKey(@Nullable String text, int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive, got " + maxLength);
        }
        if (text == null || text.isBlank()) {
            return CanonicalKey.EMPTY;
        }

        var normalized = normalizeLineBreaks(text);
        if (!normalized.isEmpty() && normalized.charAt(0) == BOM) {
            normalized = normalized.substring(1);
            if (normalized.isBlank()) {
                return CanonicalKey.EMPTY;
            }
        }
        return new CanonicalKey(truncate(normalized, maxLength));
    }

    static String normalizeLineBreaks(String text) {
        if (text.indexOf('\r') < 0) {
            return text;
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Cuts to exactly {@code maxLength} chars. A surrogate pair straddling the cut keeps its high half, so every
     * over-long text yields a key of the same length.
     */
    static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
