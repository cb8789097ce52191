package ai.lineage.hierarchy;

import static ai.lineage.testutil.TaskFixtures.corpus;
import static ai.lineage.testutil.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;

import ai.lineage.hierarchy.ParentValidation.Rejection;
import org.junit.jupiter.api.Test;

class ParentValidationTest {

    private final ResolvedEdges edges = new ResolvedEdges();

    @Test
    void testValidParent() {
        var parent = task("p", "plan", 0);
        var child = task("c", "work", 5);
        var result = ParentValidation.check(child, "p", corpus(parent, child), edges, true);

        assertTrue(result.valid());
        assertNull(result.rejection());
    }

    @Test
    void testRejections() {
        var parent = task("p", "plan", 10);
        var child = task("c", "work", 5);
        var foreign = task("f", "plan", null, "/elsewhere", 0);
        var corpus = corpus(parent, child, foreign);

        assertEquals(Rejection.SELF_REFERENCE, ParentValidation.check(child, "c", corpus, edges, true).rejection());
        assertEquals(
                Rejection.MISSING_PARENT, ParentValidation.check(child, "ghost", corpus, edges, true).rejection());
        assertEquals(
                Rejection.CREATED_AFTER_CHILD, ParentValidation.check(child, "p", corpus, edges, true).rejection());
        assertEquals(
                Rejection.WORKSPACE_MISMATCH, ParentValidation.check(child, "f", corpus, edges, true).rejection());
        assertTrue(ParentValidation.check(child, "f", corpus, edges, false).valid());
    }

    @Test
    void testCycleRejected() {
        var a = task("a", "plan", 0);
        var b = task("b", "work", 5);
        edges.accept("b", "a");

        var result = ParentValidation.check(a, "b", corpus(a, b), edges, true);
        assertEquals(Rejection.CYCLE, result.rejection());
        assertNotNull(result.reason());
    }
}
