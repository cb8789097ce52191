package ai.lineage.instructions;

import static ai.lineage.instructions.SubInstructionExtractor.extractSubInstructions;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SubInstructionExtractorTest {

    @Test
    void testTwoNumberedSteps() {
        var text =
                """
                We split the work in two.
                1. Create a subtask with **Message:** "A1: do X"
                2. Create a subtask with **Message:** "A2: do Y"
                """;
        assertEquals(List.of("A1: do X", "A2: do Y"), extractSubInstructions(text));
    }

    @Test
    void testStepsWithoutQuotesYieldNothing() {
        var text =
                """
                1. Read the code
                2. Fix the bug
                - Then write the report
                """;
        assertEquals(List.of(), extractSubInstructions(text));
    }

    @Test
    void testBlankInput() {
        assertEquals(List.of(), extractSubInstructions(null));
        assertEquals(List.of(), extractSubInstructions("   \n  "));
    }

    @Test
    void testSeveralLiteralsInOneStep() {
        var text = "1) First message: \"one\" and the follow-up message: \"two\"";
        assertEquals(List.of("one", "two"), extractSubInstructions(text));
    }

    @Test
    void testBulletMarkersAndLabelDecoration() {
        var text =
                """
                - **Message**: "dash bullet"
                * _task_: "star bullet"
                + Message:
                  "quote on the next line"
                """;
        assertEquals(
                List.of("dash bullet", "star bullet", "quote on the next line"), extractSubInstructions(text));
    }

    @Test
    void testMultilineLiteralKeptVerbatim() {
        var text =
                """
                1. Message: "line one
                   line two"
                2. Done.
                """;
        assertEquals(List.of("line one\n   line two"), extractSubInstructions(text));
    }

    @Test
    void testLiteralMayContainBulletLines() {
        var text = "1. **Message:** \"Refactor the parser:\n- split the lexer\n- add tests\"\n2. **Message:** \"Write docs\"";
        assertEquals(
                List.of("Refactor the parser:\n- split the lexer\n- add tests", "Write docs"),
                extractSubInstructions(text));
    }

    @Test
    void testLiteralMayContainNumberedLines() {
        var text =
                """
                1. Message: "Ship the release:
                   1. bump the version
                   2. tag the commit"
                2. Message: "Announce it"
                """;
        assertEquals(
                List.of("Ship the release:\n   1. bump the version\n   2. tag the commit", "Announce it"),
                extractSubInstructions(text));
    }

    @Test
    void testLiteralMayContainFence() {
        var text =
                """
                1. Message: "Run this:
                ```
                make test
                ```
                then report"
                2. Message: "Done"
                """;
        assertEquals(
                List.of("Run this:\n```\nmake test\n```\nthen report", "Done"), extractSubInstructions(text));
    }

    @Test
    void testWindowsLineBreaksNormalized() {
        var text = "1. Message: \"first\r\nsecond\"\r\n2. Message: \"third\"";
        assertEquals(List.of("first\nsecond", "third"), extractSubInstructions(text));
    }

    @Test
    void testEscapedQuotesAreUnescaped() {
        var text =
                """
                1. Message: "say \\"hi\\" to the \\\\ team"
                """;
        assertEquals(List.of("say \"hi\" to the \\ team"), extractSubInstructions(text));
    }

    @Test
    void testUnterminatedQuoteRunsToEndOfStep() {
        var text =
                """
                1. Message: "runs to the end
                   still inside
                2. Message: "next"
                """;
        assertEquals(List.of("runs to the end\n   still inside", "next"), extractSubInstructions(text));
    }

    @Test
    void testCurlyQuotesAndGuillemets() {
        var text =
                """
                1. Message: “smart quotes”
                2. Message : «Corriger le bug»
                """;
        assertEquals(List.of("smart quotes", "Corriger le bug"), extractSubInstructions(text));
    }

    @Test
    void testFencedCodeIsSkipped() {
        var text =
                """
                1. Run this first:
                ```
                message: "not an instruction"
                2. Message: "inside the fence"
                ```
                2. Message: "outside the fence"
                """;
        assertEquals(List.of("outside the fence"), extractSubInstructions(text));
    }

    @Test
    void testPathLikeLiteralsAreSkipped() {
        var text =
                """
                1. Open the file: "src/main/App.java"
                2. Then edit: "README.md"
                3. Windows path: "C:\\\\work\\\\notes"
                4. Message: "Update README.md with the usage section"
                """;
        assertEquals(List.of("Update README.md with the usage section"), extractSubInstructions(text));
    }

    @Test
    void testQuotesOutsideTheLabelPatternAreIgnored() {
        var text =
                """
                Message: "not inside a step"
                1. Use the "fast" mode
                2. Message: ""
                """;
        assertEquals(List.of(), extractSubInstructions(text));
    }

    @Test
    void testNewTaskMessageExtracted() {
        var text =
                """
                Delegating now.
                <new_task>
                <mode>code</mode>
                <message>Use &lt;div&gt; tags &amp; keep the layout</message>
                </new_task>
                """;
        assertEquals(List.of("Use <div> tags & keep the layout"), extractSubInstructions(text));
    }

    @Test
    void testNewTaskWithoutMessageUsesBody() {
        var text = "<new_task><mode>debug</mode>Find the leak in the cache</new_task>";
        assertEquals(List.of("Find the leak in the cache"), extractSubInstructions(text));
    }

    @Test
    void testNewTaskInsideFenceIgnored() {
        var text =
                """
                ~~~
                <new_task><message>example only</message></new_task>
                ~~~
                """;
        assertEquals(List.of(), extractSubInstructions(text));
    }

    @Test
    void testDocumentOrderAcrossShapes() {
        var text =
                """
                <new_task><message>delegated first</message></new_task>
                1. Message: "step second"
                """;
        assertEquals(List.of("delegated first", "step second"), extractSubInstructions(text));
    }

    @Test
    void testLooksLikePath() {
        assertTrue(SubInstructionExtractor.looksLikePath("src/Main.java"));
        assertTrue(SubInstructionExtractor.looksLikePath("config.yaml"));
        assertFalse(SubInstructionExtractor.looksLikePath("fix the bug in config.yaml"));
        assertFalse(SubInstructionExtractor.looksLikePath("Refactor"));
        assertFalse(SubInstructionExtractor.isInstructionLike("  "));
    }
}
