package ai.lineage.hierarchy;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Child-to-parent edges accepted so far in a reconstruction pass. Used to keep iterative resolution acyclic: a task
 * may not adopt one of its own descendants as parent.
 */
public final class ResolvedEdges {
    private final Map<String, String> parentByChild = new HashMap<>();
    private final SetMultimap<String, String> childrenByParent = LinkedHashMultimap.create();

    /**
     * Records {@code childTaskId -> parentTaskId}, replacing any earlier parent of the child.
     *
     * @return false, leaving the graph unchanged, if the edge is a self-loop or would close a cycle.
     */
    public boolean accept(String childTaskId, String parentTaskId) {
        if (wouldCreateCycle(childTaskId, parentTaskId)) {
            return false;
        }
        var previous = parentByChild.put(childTaskId, parentTaskId);
        if (previous != null) {
            childrenByParent.remove(previous, childTaskId);
        }
        childrenByParent.put(parentTaskId, childTaskId);
        return true;
    }

    /** True if walking up from {@code parentTaskId} reaches {@code childTaskId}. */
    public boolean wouldCreateCycle(String childTaskId, String parentTaskId) {
        var visited = new HashSet<String>();
        String current = parentTaskId;
        while (current != null) {
            if (current.equals(childTaskId) || !visited.add(current)) {
                return true;
            }
            current = parentByChild.get(current);
        }
        return false;
    }

    public Optional<String> parentOf(String childTaskId) {
        return Optional.ofNullable(parentByChild.get(childTaskId));
    }

    public Set<String> childrenOf(String parentTaskId) {
        return Collections.unmodifiableSet(childrenByParent.get(parentTaskId));
    }

    /** Every task below {@code taskId}, breadth first. */
    public Set<String> descendantsOf(String taskId) {
        var result = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>(childrenByParent.get(taskId));
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (result.add(next)) {
                queue.addAll(childrenByParent.get(next));
            }
        }
        return result;
    }

    public int size() {
        return parentByChild.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(parentByChild);
    }
}
