package ai.lineage.cli;

import ai.lineage.LineageConfig;
import ai.lineage.corpus.JsonTaskCorpusLoader;
import ai.lineage.corpus.TaskCorpus;
import ai.lineage.hierarchy.HierarchyMatcher;
import ai.lineage.hierarchy.HierarchyReconstructor;
import ai.lineage.hierarchy.ParentSelectionPolicy;
import ai.lineage.hierarchy.ReconstructionResult;
import ai.lineage.hierarchy.ResolutionMethod;
import ai.lineage.instructions.CandidateMatch;
import ai.lineage.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "lineage-cli",
        mixinStandardHelpOptions = true,
        description = "Rebuilds parent/child links between tasks of a corpus from quoted sub-task instructions.")
public final class LineageCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(LineageCli.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = "--corpus",
            required = true,
            description = "JSON file with the tasks: an array, or an object with a 'tasks' array.")
    private Path corpusPath;

    @CommandLine.Option(names = "--max-length", description = "Canonical key bound (default from configuration).")
    @Nullable
    private Integer maxLength;

    @CommandLine.Option(
            names = "--min-prefix",
            description = "Shortest shared prefix accepted for non-exact matches (default from configuration).")
    @Nullable
    private Integer minPrefix;

    @CommandLine.Option(
            names = "--policy",
            description = "Tie-break among several parents: ${COMPLETION-CANDIDATES}.")
    @Nullable
    private ParentSelectionPolicy policy;

    @CommandLine.Option(
            names = "--no-fallback",
            description = "Do not register a parent's full text when it quotes no sub-instruction.")
    private boolean noFallback;

    @CommandLine.Option(names = "--ignore-workspace", description = "Accept parents from other workspaces.")
    private boolean ignoreWorkspace;

    @CommandLine.Option(names = "--json", description = "Print the result as JSON.")
    private boolean json;

    @CommandLine.Option(
            names = "--query",
            description = "Instead of a full reconstruction, print the candidate parents of this instruction text.")
    @Nullable
    private String query;

    public static void main(String[] args) {
        logger.info("Starting lineage CLI...");
        int exitCode = new CommandLine(new LineageCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    @Blocking
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        LineageConfig config;
        try {
            config = effectiveConfig(LineageConfig.load());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        TaskCorpus corpus;
        try {
            corpus = new JsonTaskCorpusLoader(corpusPath).load();
        } catch (IOException e) {
            logger.error("Failed to load corpus {}", corpusPath, e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try {
            if (query != null) {
                printCandidates(out, runQuery(corpus, config, query));
            } else {
                printResult(out, new HierarchyReconstructor(config).reconstruct(corpus));
            }
        } catch (JsonProcessingException e) {
            err.println("Error: could not render JSON: " + e.getOriginalMessage());
            return 1;
        }
        out.flush();
        return 0;
    }

    LineageConfig effectiveConfig(LineageConfig base) {
        var config = base;
        if (maxLength != null) {
            config = config.withMaxKeyLength(maxLength);
        }
        if (minPrefix != null) {
            config = config.withMinPrefixLength(minPrefix);
        }
        if (policy != null) {
            config = config.withParentSelectionPolicy(policy);
        }
        if (noFallback) {
            config = config.withRegisterFullTextFallback(false);
        }
        if (ignoreWorkspace) {
            config = config.withRequireSameWorkspace(false);
        }
        return config;
    }

    private static List<CandidateMatch> runQuery(TaskCorpus corpus, LineageConfig config, String text) {
        var matcher = HierarchyMatcher.forPass(config);
        for (var task : corpus) {
            matcher.addParentTaskWithSubInstructions(task.taskId(), task.instruction());
        }
        return matcher.index().searchExactPrefix(text, config.maxKeyLength());
    }

    private void printCandidates(PrintWriter out, List<CandidateMatch> candidates) throws JsonProcessingException {
        if (json) {
            out.println(Json.MAPPER.writeValueAsString(candidates));
            return;
        }
        if (candidates.isEmpty()) {
            out.println("No candidate parent.");
            return;
        }
        for (var c : candidates) {
            out.printf("%s\t%d\t%s%n", c.parentTaskId(), c.matchedPrefixLength(), c.kind());
        }
    }

    private void printResult(PrintWriter out, ReconstructionResult result) throws JsonProcessingException {
        if (json) {
            out.println(Json.MAPPER.writeValueAsString(result));
            return;
        }
        for (var r : result.resolutions().values()) {
            if (r.parentTaskId() != null) {
                out.printf("%s -> %s [%s]%n", r.taskId(), r.parentTaskId(), r.method());
            } else {
                out.printf("%s [%s]%n", r.taskId(), r.method());
            }
        }
        var phaseTwo = result.phaseTwo();
        out.printf(
                "%d task(s): %d persisted, %d matched, %d root(s), %d unresolved; index %d key(s)%n",
                phaseTwo.processedCount(),
                phaseTwo.count(ResolutionMethod.PERSISTED) + phaseTwo.count(ResolutionMethod.PERSISTED_EXTERNAL),
                phaseTwo.count(ResolutionMethod.INSTRUCTION_MATCH),
                phaseTwo.count(ResolutionMethod.ROOT),
                phaseTwo.count(ResolutionMethod.UNRESOLVED),
                result.index().totalNodes());
    }
}
