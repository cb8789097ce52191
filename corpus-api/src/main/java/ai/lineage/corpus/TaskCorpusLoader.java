package ai.lineage.corpus;

import java.io.IOException;
import org.jetbrains.annotations.Blocking;

/**
 * Supplies the tasks of one corpus. Implementations own the storage format; the hierarchy engine only sees
 * {@link TaskRecord}s.
 */
public interface TaskCorpusLoader {

    /** Loads every task of the corpus. */
    @Blocking
    TaskCorpus load() throws IOException;

    /** Human-readable description of where the tasks come from, for log messages. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
