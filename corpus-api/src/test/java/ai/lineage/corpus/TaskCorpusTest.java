package ai.lineage.corpus;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TaskCorpusTest {

    @Test
    void duplicateIdsKeepFirstRecord() {
        var corpus = TaskCorpus.of(List.of(
                new TaskRecord("t1", "first"), new TaskRecord("t2", "second"), new TaskRecord("t1", "shadowed")));

        assertEquals(2, corpus.size());
        assertEquals("first", corpus.get("t1").orElseThrow().instruction());
        assertEquals(List.of("t1", "t2"), corpus.taskIds(), "Corpus order should follow the loader");
    }

    @Test
    void emptyCorpus() {
        var corpus = TaskCorpus.empty();
        assertTrue(corpus.isEmpty());
        assertFalse(corpus.contains("anything"));
        assertTrue(corpus.get("anything").isEmpty());
    }

    @Test
    void instructionAndParentPredicates() {
        var blank = new TaskRecord("t1", "   ");
        assertFalse(blank.hasInstruction());
        assertFalse(blank.hasPersistedParent());

        var linked = new TaskRecord("t2", "do it", "t1", "/ws", null);
        assertTrue(linked.hasInstruction());
        assertTrue(linked.hasPersistedParent());
        assertFalse(linked.withParentTaskId(null).hasPersistedParent());
    }

    @Test
    void taskIdIsRequired() {
        assertThrows(NullPointerException.class, () -> new TaskRecord(null, "orphan"));
        assertThrows(IllegalArgumentException.class, () -> new TaskRecord("  ", "orphan"));
    }
}
