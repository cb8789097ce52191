package ai.lineage.hierarchy;

import ai.lineage.instructions.IndexStats;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Everything a reconstruction pass produced. */
public record ReconstructionResult(
        Map<String, ResolvedParent> resolutions, PhaseOneStats phaseOne, PhaseTwoStats phaseTwo, IndexStats index) {

    public ReconstructionResult {
        resolutions = Collections.unmodifiableMap(new LinkedHashMap<>(resolutions));
    }

    /** A per-task failure. The pass continued without this task. */
    public record TaskError(String taskId, String phase, String message) {}

    /**
     * @param processedCount tasks examined.
     * @param parsedCount tasks that registered at least one key.
     * @param registeredCount keys registered over all tasks.
     */
    public record PhaseOneStats(
            int processedCount, int parsedCount, int registeredCount, List<TaskError> errors, long elapsedMillis) {
        public PhaseOneStats {
            errors = List.copyOf(errors);
        }
    }

    public record PhaseTwoStats(
            int processedCount,
            Map<ResolutionMethod, Integer> methods,
            int discardedPersistedLinks,
            List<TaskError> errors,
            long elapsedMillis) {
        public PhaseTwoStats {
            var byMethod = new EnumMap<ResolutionMethod, Integer>(ResolutionMethod.class);
            byMethod.putAll(methods);
            methods = Collections.unmodifiableMap(byMethod);
            errors = List.copyOf(errors);
        }

        public int count(ResolutionMethod method) {
            return methods.getOrDefault(method, 0);
        }
    }

    public Optional<ResolvedParent> get(String taskId) {
        return Optional.ofNullable(resolutions.get(taskId));
    }

    public Optional<String> parentOf(String taskId) {
        return get(taskId).map(ResolvedParent::parentTaskId);
    }

    /** Child-to-parent edges in corpus order, roots and unresolved tasks omitted. */
    public Map<String, String> edges() {
        var result = new LinkedHashMap<String, String>();
        for (var r : resolutions.values()) {
            if (r.parentTaskId() != null) {
                result.put(r.taskId(), r.parentTaskId());
            }
        }
        return result;
    }
}
