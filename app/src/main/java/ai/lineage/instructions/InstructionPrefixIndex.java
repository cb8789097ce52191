package ai.lineage.instructions;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Prefix index from canonical instruction keys to the tasks that registered them.
 *
 * <p>Keys live in a character trie stored as an arena: node {@code n} is described by {@code labels[n]},
 * {@code firstChild[n]} and {@code nextSibling[n]}, and {@code entries[n]} is non-null only where a registered key
 * ends. A path that merely passes through a node does not register anything there, so two instructions sharing a
 * template header are not confused with each other.
 *
 * <p>The index is built once per reconstruction pass: populate it completely, then query it. It is not thread-safe.
 */
public final class InstructionPrefixIndex {
    private static final Logger logger = LogManager.getLogger(InstructionPrefixIndex.class);

    private static final int ROOT = 0;
    private static final int NONE = -1;
    private static final int INITIAL_CAPACITY = 256;

    private final int maxKeyLength;
    private final int minPrefixLength;

    private char[] labels = new char[INITIAL_CAPACITY];
    private int[] firstChild = new int[INITIAL_CAPACITY];
    private int[] nextSibling = new int[INITIAL_CAPACITY];
    private IndexEntry[] entries = new IndexEntry[INITIAL_CAPACITY];
    private int nodeCount;

    private final SetMultimap<String, String> keysByParent = LinkedHashMultimap.create();
    private int distinctKeys;
    private int registrations;

    public InstructionPrefixIndex() {
        this(InstructionKeys.DEFAULT_MAX_LENGTH, 0);
    }

    /**
     * @param maxKeyLength bound applied to registered keys; lookups should canonicalize with the same bound.
     * @param minPrefixLength shortest shared prefix accepted for a non-exact match. 0 accepts any non-empty prefix.
     */
    public InstructionPrefixIndex(int maxKeyLength, int minPrefixLength) {
        if (maxKeyLength < 1) {
            throw new IllegalArgumentException("maxKeyLength must be positive, got " + maxKeyLength);
        }
        if (minPrefixLength < 0) {
            throw new IllegalArgumentException("minPrefixLength must not be negative, got " + minPrefixLength);
        }
        this.maxKeyLength = maxKeyLength;
        this.minPrefixLength = minPrefixLength;
        allocateNode('\0');
    }

    public int maxKeyLength() {
        return maxKeyLength;
    }

    public int minPrefixLength() {
        return minPrefixLength;
    }

    public void addInstruction(String taskId, String canonicalKey) {
        addInstruction(taskId, new CanonicalKey(canonicalKey), null);
    }

    public void addInstruction(String taskId, String canonicalKey, @Nullable String originalText) {
        addInstruction(taskId, new CanonicalKey(canonicalKey), originalText);
    }

    /**
     * Registers {@code taskId} under {@code key}. Registering the same pair again changes nothing. Empty keys and
     * blank task ids are ignored.
     */
    public void addInstruction(String taskId, CanonicalKey key, @Nullable String originalText) {
        if (key.isEmpty() || taskId.isBlank()) {
            logger.debug("Ignoring registration with empty key or task id (task '{}')", taskId);
            return;
        }

        var keyText = key.value();
        if (keyText.length() > maxKeyLength) {
            logger.warn(
                    "Key of length {} registered by {} exceeds the bound of {}; cutting it",
                    keyText.length(),
                    taskId,
                    maxKeyLength);
            keyText = InstructionKeys.truncate(keyText, maxKeyLength);
        }

        int node = ROOT;
        for (int i = 0; i < keyText.length(); i++) {
            node = childOrCreate(node, keyText.charAt(i));
        }

        var entry = entries[node];
        if (entry == null) {
            entry = new IndexEntry(keyText);
            entries[node] = entry;
            distinctKeys++;
        }
        if (entry.addParent(taskId)) {
            registrations++;
            keysByParent.put(taskId, keyText);
            logger.trace("Registered key '{}' for task {}", abbreviate(keyText), taskId);
        }
        if (originalText != null) {
            entry.offerSourceText(InstructionKeys.truncate(originalText, maxKeyLength));
        }
    }

    public List<CandidateMatch> searchExactPrefix(@Nullable String candidateText) {
        return searchExactPrefix(candidateText, maxKeyLength);
    }

    /**
     * Finds every registered key that equals the canonical key of {@code candidateText}, is a strict prefix of it,
     * or extends it. Each parent appears once, with its strongest match; results are ordered by
     * {@link CandidateMatch#STRONGEST_FIRST}.
     */
    public List<CandidateMatch> searchExactPrefix(@Nullable String candidateText, int maxLength) {
        var key = InstructionKeys.computeCanonicalKey(candidateText, maxLength);
        if (key.isEmpty()) {
            return List.of();
        }
        if (maxLength != maxKeyLength) {
            logger.debug("Lookup bound {} differs from the registration bound {}", maxLength, maxKeyLength);
        }
        return search(key);
    }

    /** Same as {@link #searchExactPrefix(String, int)} for a key that is already canonical. */
    public List<CandidateMatch> search(CanonicalKey key) {
        if (key.isEmpty()) {
            return List.of();
        }
        var keyText = key.value();
        var best = new LinkedHashMap<String, CandidateMatch>();

        // registered keys on the path are prefixes of the candidate
        int node = ROOT;
        int depth = 0;
        while (depth < keyText.length()) {
            int child = findChild(node, keyText.charAt(depth));
            if (child == NONE) {
                break;
            }
            node = child;
            depth++;
            var entry = entries[node];
            if (entry != null && depth < keyText.length() && depth >= minPrefixLength) {
                offer(best, entry, depth, MatchKind.REGISTERED_PREFIX);
            }
        }

        if (depth == keyText.length()) {
            var exact = entries[node];
            if (exact != null) {
                offer(best, exact, depth, MatchKind.EXACT);
            }
            if (depth >= minPrefixLength) {
                collectExtensions(node, depth, best);
            }
        }

        var results = new ArrayList<>(best.values());
        results.sort(CandidateMatch.STRONGEST_FIRST);
        logger.trace("Lookup of '{}' produced {} candidate(s)", abbreviate(keyText), results.size());
        return results;
    }

    /** Registered keys strictly below {@code start}: the candidate key is a prefix of each of them. */
    private void collectExtensions(int start, int matchedLength, Map<String, CandidateMatch> best) {
        var stack = new ArrayDeque<Integer>();
        pushChildren(start, stack);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            var entry = entries[node];
            if (entry != null) {
                offer(best, entry, matchedLength, MatchKind.CANDIDATE_PREFIX);
            }
            pushChildren(node, stack);
        }
    }

    private void pushChildren(int node, ArrayDeque<Integer> stack) {
        // push in reverse so that siblings pop in insertion order
        var children = new ArrayList<Integer>();
        for (int c = firstChild[node]; c != NONE; c = nextSibling[c]) {
            children.add(c);
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    private static void offer(Map<String, CandidateMatch> best, IndexEntry entry, int length, MatchKind kind) {
        for (var parentId : entry.parentTaskIds()) {
            var candidate = new CandidateMatch(parentId, length, kind);
            var current = best.get(parentId);
            if (current == null || candidate.isStrongerThan(current)) {
                best.put(parentId, candidate);
            }
        }
    }

    /** True if a lookup of {@code childText} returns {@code parentTaskId}. */
    public boolean validateParentChildRelation(@Nullable String childText, @Nullable String parentTaskId) {
        if (childText == null || parentTaskId == null || parentTaskId.isBlank()) {
            return false;
        }
        return searchExactPrefix(childText, maxKeyLength).stream()
                .anyMatch(m -> m.parentTaskId().equals(parentTaskId));
    }

    /** The keys registered by {@code parentTaskId}, in registration order. */
    public List<String> getInstructionsByParent(String parentTaskId) {
        return List.copyOf(keysByParent.get(parentTaskId));
    }

    public Optional<IndexEntry> findEntry(CanonicalKey key) {
        if (key.isEmpty() || key.length() > maxKeyLength) {
            return Optional.empty();
        }
        int node = ROOT;
        for (int i = 0; i < key.length() && node != NONE; i++) {
            node = findChild(node, key.value().charAt(i));
        }
        return node == NONE ? Optional.empty() : Optional.ofNullable(entries[node]);
    }

    /**
     * Registers previously computed prefixes, e.g. those cached by the loader alongside each task. Each prefix is
     * canonicalized with this index's bound before registration.
     */
    public void rebuildFrom(Map<String, ? extends Collection<String>> prefixesByTask) {
        logger.info("Rebuilding instruction index from {} task(s)", prefixesByTask.size());
        for (var e : prefixesByTask.entrySet()) {
            for (var prefix : e.getValue()) {
                addInstruction(e.getKey(), InstructionKeys.computeCanonicalKey(prefix, maxKeyLength), prefix);
            }
        }
        logger.info("Instruction index rebuilt: {}", getStats());
    }

    public IndexStats getStats() {
        return new IndexStats(distinctKeys, registrations, nodeCount);
    }

    /** Number of distinct keys. */
    public int size() {
        return distinctKeys;
    }

    public boolean isEmpty() {
        return distinctKeys == 0;
    }

    // -- arena management --

    private int findChild(int node, char label) {
        for (int c = firstChild[node]; c != NONE; c = nextSibling[c]) {
            if (labels[c] == label) {
                return c;
            }
        }
        return NONE;
    }

    private int childOrCreate(int node, char label) {
        int last = NONE;
        for (int c = firstChild[node]; c != NONE; c = nextSibling[c]) {
            if (labels[c] == label) {
                return c;
            }
            last = c;
        }
        int created = allocateNode(label);
        if (last == NONE) {
            firstChild[node] = created;
        } else {
            nextSibling[last] = created;
        }
        return created;
    }

    private int allocateNode(char label) {
        if (nodeCount == labels.length) {
            int capacity = labels.length * 2;
            labels = Arrays.copyOf(labels, capacity);
            firstChild = Arrays.copyOf(firstChild, capacity);
            nextSibling = Arrays.copyOf(nextSibling, capacity);
            entries = Arrays.copyOf(entries, capacity);
        }
        int node = nodeCount++;
        labels[node] = label;
        firstChild[node] = NONE;
        nextSibling[node] = NONE;
        entries[node] = null;
        return node;
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 60) + "...";
    }
}
