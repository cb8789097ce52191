package ai.lineage.instructions;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** The parents registered under one canonical key. */
public final class IndexEntry {
    private final String key;
    private final Set<String> parentTaskIds = new LinkedHashSet<>();
    private @Nullable String sourceText;

    IndexEntry(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /** Parents that registered exactly this key, in first-registration order. */
    public Set<String> parentTaskIds() {
        return Collections.unmodifiableSet(parentTaskIds);
    }

    /** First original text that produced the key. Diagnostics only. */
    public @Nullable String sourceText() {
        return sourceText;
    }

    boolean addParent(String taskId) {
        return parentTaskIds.add(taskId);
    }

    void offerSourceText(@Nullable String text) {
        if (sourceText == null && text != null && !text.isBlank()) {
            sourceText = text;
        }
    }

    @Override
    public String toString() {
        return "IndexEntry[key=%s, parents=%s]".formatted(key, parentTaskIds);
    }
}
