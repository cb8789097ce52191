package ai.lineage.hierarchy;

import ai.lineage.LineageConfig;
import ai.lineage.corpus.TaskCorpus;
import ai.lineage.corpus.TaskRecord;
import ai.lineage.hierarchy.ParentSelectionPolicy.ScoredCandidate;
import ai.lineage.hierarchy.ReconstructionResult.PhaseOneStats;
import ai.lineage.hierarchy.ReconstructionResult.PhaseTwoStats;
import ai.lineage.hierarchy.ReconstructionResult.TaskError;
import ai.lineage.instructions.CandidateMatch;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Two-phase reconstruction of the task hierarchy of one corpus.
 *
 * <p>Phase 1 registers the sub-instructions quoted by every task. Phase 2 walks the corpus in order: a valid
 * persisted parent link is kept, otherwise the task's instruction is looked up and one validated candidate is chosen
 * by the configured {@link ParentSelectionPolicy}. A failure on one task is recorded and the pass moves on.
 */
public final class HierarchyReconstructor {
    private static final Logger logger = LogManager.getLogger(HierarchyReconstructor.class);

    private final LineageConfig config;

    public HierarchyReconstructor(LineageConfig config) {
        this.config = config;
    }

    public ReconstructionResult reconstruct(TaskCorpus corpus) {
        logger.info("Starting hierarchy reconstruction of {} task(s)", corpus.size());
        var matcher = HierarchyMatcher.forPass(config);

        var phaseOne = executePhaseOne(corpus, matcher);
        logger.info(
                "Phase 1 done: {} parsed of {} processed, {} key(s) registered, {} error(s) in {} ms",
                phaseOne.parsedCount(),
                phaseOne.processedCount(),
                phaseOne.registeredCount(),
                phaseOne.errors().size(),
                phaseOne.elapsedMillis());

        var resolutions = new LinkedHashMap<String, ResolvedParent>();
        var phaseTwo = executePhaseTwo(corpus, matcher, resolutions);
        logger.info(
                "Phase 2 done: {} processed, methods {}, {} persisted link(s) discarded, {} error(s) in {} ms",
                phaseTwo.processedCount(),
                phaseTwo.methods(),
                phaseTwo.discardedPersistedLinks(),
                phaseTwo.errors().size(),
                phaseTwo.elapsedMillis());

        return new ReconstructionResult(resolutions, phaseOne, phaseTwo, matcher.index().getStats());
    }

    PhaseOneStats executePhaseOne(TaskCorpus corpus, HierarchyMatcher matcher) {
        long start = System.currentTimeMillis();
        int processed = 0;
        int parsed = 0;
        int registered = 0;
        var errors = new ArrayList<TaskError>();

        for (var task : corpus) {
            processed++;
            if (!task.hasInstruction()) {
                continue;
            }
            try {
                int count = matcher.addParentTaskWithSubInstructions(task.taskId(), task.instruction());
                if (count > 0) {
                    parsed++;
                    registered += count;
                }
            } catch (RuntimeException e) {
                logger.warn("Phase 1 failed for task {}: {}", task.taskId(), e.getMessage(), e);
                errors.add(new TaskError(task.taskId(), "phase1", String.valueOf(e.getMessage())));
            }
        }
        return new PhaseOneStats(processed, parsed, registered, errors, System.currentTimeMillis() - start);
    }

    PhaseTwoStats executePhaseTwo(
            TaskCorpus corpus, HierarchyMatcher matcher, Map<String, ResolvedParent> resolutions) {
        long start = System.currentTimeMillis();
        var methods = new EnumMap<ResolutionMethod, Integer>(ResolutionMethod.class);
        var errors = new ArrayList<TaskError>();
        int processed = 0;
        int discarded = 0;

        for (var task : corpus) {
            processed++;
            ResolvedParent resolution;
            try {
                var persisted = checkPersistedParent(task, corpus, matcher);
                if (persisted.resolution() != null) {
                    resolution = persisted.resolution();
                } else {
                    if (persisted.discardReason() != null) {
                        discarded++;
                    }
                    resolution = resolveFromInstruction(task, corpus, matcher, persisted.discardReason());
                }
            } catch (RuntimeException e) {
                logger.warn("Phase 2 failed for task {}: {}", task.taskId(), e.getMessage(), e);
                errors.add(new TaskError(task.taskId(), "phase2", String.valueOf(e.getMessage())));
                resolution =
                        new ResolvedParent(task.taskId(), null, ResolutionMethod.UNRESOLVED, List.of(), e.getMessage());
            }
            resolutions.put(task.taskId(), resolution);
            methods.merge(resolution.method(), 1, Integer::sum);
        }
        return new PhaseTwoStats(processed, methods, discarded, errors, System.currentTimeMillis() - start);
    }

    /**
     * @param resolution set when the persisted link is kept.
     * @param discardReason set when a persisted link existed but was rejected.
     */
    private record PersistedCheck(@Nullable ResolvedParent resolution, @Nullable String discardReason) {}

    private PersistedCheck checkPersistedParent(TaskRecord task, TaskCorpus corpus, HierarchyMatcher matcher) {
        if (!task.hasPersistedParent()) {
            return new PersistedCheck(null, null);
        }
        var parentId = task.parentTaskId();
        assert parentId != null;
        if (!corpus.contains(parentId)) {
            // resolved later if the instruction matches nothing
            return new PersistedCheck(null, null);
        }

        var validation =
                ParentValidation.check(task, parentId, corpus, matcher.edges(), config.requireSameWorkspace());
        if (validation.valid() && matcher.acceptParent(task.taskId(), parentId)) {
            return new PersistedCheck(
                    new ResolvedParent(task.taskId(), parentId, ResolutionMethod.PERSISTED, List.of(), null), null);
        }
        var reason = validation.valid() ? "would create a cycle" : validation.reason();
        logger.debug("Discarding persisted parent {} of {}: {}", parentId, task.taskId(), reason);
        return new PersistedCheck(null, "persisted parent " + parentId + " discarded: " + reason);
    }

    private ResolvedParent resolveFromInstruction(
            TaskRecord task, TaskCorpus corpus, HierarchyMatcher matcher, @Nullable String note) {
        var externalParent = task.hasPersistedParent() && note == null ? task.parentTaskId() : null;

        if (!task.hasInstruction()) {
            return fallback(task, externalParent, List.of(), note);
        }

        var matches = matcher.resolveParent(task.taskId(), task.instruction());
        var validated = new ArrayList<ScoredCandidate>();
        for (var match : matches) {
            var validation = ParentValidation.check(
                    task, match.parentTaskId(), corpus, matcher.edges(), config.requireSameWorkspace());
            if (validation.valid()) {
                validated.add(new ScoredCandidate(corpus.get(match.parentTaskId()).orElseThrow(), match));
            } else {
                logger.trace("Candidate {} for {} rejected: {}", match.parentTaskId(), task.taskId(), validation.reason());
            }
        }
        List<CandidateMatch> candidateMatches =
                validated.stream().map(ScoredCandidate::match).toList();

        if (validated.isEmpty()) {
            return fallback(task, externalParent, candidateMatches, note);
        }

        var chosen = config.parentSelectionPolicy().choose(task, validated);
        if (chosen.isPresent() && matcher.acceptParent(task.taskId(), chosen.get().parentTaskId())) {
            var parentId = chosen.get().parentTaskId();
            logger.debug(
                    "Resolved {} -> {} from {} candidate(s)", task.taskId(), parentId, validated.size());
            return new ResolvedParent(
                    task.taskId(), parentId, ResolutionMethod.INSTRUCTION_MATCH, candidateMatches, note);
        }

        logger.debug(
                "{} candidate(s) for {} but none chosen under {}",
                validated.size(),
                task.taskId(),
                config.parentSelectionPolicy());
        return new ResolvedParent(
                task.taskId(),
                null,
                ResolutionMethod.UNRESOLVED,
                candidateMatches,
                note != null ? note : "ambiguous: " + validated.size() + " candidates");
    }

    private static ResolvedParent fallback(
            TaskRecord task, @Nullable String externalParent, List<CandidateMatch> candidates, @Nullable String note) {
        if (externalParent != null) {
            return new ResolvedParent(
                    task.taskId(),
                    externalParent,
                    ResolutionMethod.PERSISTED_EXTERNAL,
                    candidates,
                    "parent " + externalParent + " is outside the corpus");
        }
        return new ResolvedParent(task.taskId(), null, ResolutionMethod.ROOT, candidates, note);
    }
}
